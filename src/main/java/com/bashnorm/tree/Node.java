package com.bashnorm.tree;

import com.bashnorm.grammar.ArgType;
import com.bashnorm.raw.Span;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Node of a canonical command tree.
 *
 * <p>A node owns its children. The parent link and the sibling accessors are
 * non-owning and always derived from the parent's ordered child list, so they
 * cannot disagree with it. Every structural change goes through
 * {@link #addChild}, {@link #insertChild}, {@link #removeChild} or
 * {@link #replaceChild}, which keep the parent links consistent.
 */
public abstract sealed class Node
        permits Node.Root, Node.Pipeline, Node.CommandSubstitution, Node.ProcessSubstitution,
                Node.HeadCommand, Node.Flag, Node.Argument, Node.UnaryLogicOp, Node.BinaryLogicOp {

    private String value;
    private final Span span;
    private Node parent;
    private final MutableList<Node> children = Lists.mutable.empty();

    protected Node(String value, Span span) {
        this.value = Objects.requireNonNull(value, "value");
        this.span = span;
    }

    public abstract NodeKind kind();

    /** Copy of this node without children or parent. */
    protected abstract Node copyNode();

    public String value() {
        return value;
    }

    public void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /** Source offsets of the word this node came from, or {@code null}. */
    public Span span() {
        return span;
    }

    public Node parent() {
        return parent;
    }

    public ListIterable<Node> children() {
        return children.asUnmodifiable();
    }

    public int numChildren() {
        return children.size();
    }

    public boolean hasChildren() {
        return children.notEmpty();
    }

    public Node child(int index) {
        return children.get(index);
    }

    public Node firstChild() {
        return children.isEmpty() ? null : children.getFirst();
    }

    public Node lastChild() {
        return children.isEmpty() ? null : children.getLast();
    }

    public int indexOfChild(Node child) {
        return children.detectIndex(c -> c == child);
    }

    public Node leftSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOfChild(this);
        return index > 0 ? parent.children.get(index - 1) : null;
    }

    public Node rightSibling() {
        if (parent == null) {
            return null;
        }
        int index = parent.indexOfChild(this);
        return index >= 0 && index + 1 < parent.children.size() ? parent.children.get(index + 1) : null;
    }

    public void addChild(Node child) {
        insertChild(children.size(), child);
    }

    /** Inserts {@code child}, detaching it from its current parent first. */
    public void insertChild(int index, Node child) {
        if (child == this) {
            throw new IllegalArgumentException("A node cannot be its own child");
        }
        if (child.parent != null) {
            child.detach();
        }
        children.add(index, child);
        child.parent = this;
    }

    public void removeChild(Node child) {
        int index = indexOfChild(child);
        if (index < 0) {
            throw new IllegalArgumentException("Not a child of " + symbol() + ": " + child.symbol());
        }
        children.remove(index);
        child.parent = null;
    }

    public void replaceChild(Node oldChild, Node replacement) {
        int index = indexOfChild(oldChild);
        if (index < 0) {
            throw new IllegalArgumentException("Not a child of " + symbol() + ": " + oldChild.symbol());
        }
        if (replacement.parent != null) {
            replacement.detach();
            index = indexOfChild(oldChild);
        }
        children.set(index, replacement);
        oldChild.parent = null;
        replacement.parent = this;
    }

    public void detach() {
        if (parent != null) {
            parent.removeChild(this);
        }
    }

    /** Removes and returns all children, in order. */
    public MutableList<Node> removeAllChildren() {
        MutableList<Node> removed = Lists.mutable.withAll(children);
        children.clear();
        removed.each(child -> child.parent = null);
        return removed;
    }

    /** The nearest head command at or above this node, or {@code null}. */
    public HeadCommand headCommand() {
        Node current = this;
        while (current != null) {
            if (current instanceof HeadCommand head) {
                return head;
            }
            current = current.parent;
        }
        return null;
    }

    public String symbol() {
        return kind().symbolPrefix() + "_" + value;
    }

    /**
     * Copies this subtree. The copy is detached: its root has no parent and every
     * parent link inside it points into the copy.
     */
    public Node deepCopy() {
        Node copy = copyNode();
        for (Node child : children) {
            copy.addChild(child.deepCopy());
        }
        return copy;
    }

    /**
     * Structural equality: same kinds, values and child order, and the same
     * argument types when {@code compareArgTypes} is set.
     */
    public boolean sameShape(Node other, boolean compareArgTypes) {
        if (other == null || kind() != other.kind() || !value.equals(other.value)
                || children.size() != other.children.size()) {
            return false;
        }
        if (compareArgTypes && this instanceof Argument arg
                && arg.argType() != ((Argument) other).argType()) {
            return false;
        }
        if (this instanceof UnaryLogicOp op && op.associativity() != ((UnaryLogicOp) other).associativity()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).sameShape(other.children.get(i), compareArgTypes)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, 0);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb, int indent) {
        sb.append("  ".repeat(indent)).append(symbol());
        if (this instanceof Argument arg && arg.argType() != null) {
            sb.append(" <").append(arg.argType().typeName()).append('>');
        }
        for (Node child : children) {
            sb.append('\n');
            child.appendTo(sb, indent + 1);
        }
    }

    public static final class Root extends Node {
        public Root() {
            super("root", null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ROOT;
        }

        @Override
        protected Node copyNode() {
            return new Root();
        }
    }

    public static final class Pipeline extends Node {
        public Pipeline() {
            super("|", null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PIPELINE;
        }

        @Override
        protected Node copyNode() {
            return new Pipeline();
        }
    }

    public static final class CommandSubstitution extends Node {
        public CommandSubstitution() {
            super("$(", null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMMAND_SUBSTITUTION;
        }

        @Override
        protected Node copyNode() {
            return new CommandSubstitution();
        }
    }

    /** Value is the direction, {@code <} or {@code >}. */
    public static final class ProcessSubstitution extends Node {
        public ProcessSubstitution(String direction) {
            super(direction, null);
            if (!"<".equals(direction) && !">".equals(direction)) {
                throw new IllegalArgumentException("Process substitution direction must be < or >: " + direction);
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PROCESS_SUBSTITUTION;
        }

        @Override
        protected Node copyNode() {
            return new ProcessSubstitution(value());
        }
    }

    public static final class HeadCommand extends Node {
        public HeadCommand(String name, Span span) {
            super(name, span);
        }

        public HeadCommand(String name) {
            this(name, null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.HEAD_COMMAND;
        }

        @Override
        protected Node copyNode() {
            return new HeadCommand(value(), span());
        }
    }

    /**
     * A flag. Flags that introduce an embedded command carry the delimiter that
     * closed it as a {@code ::;} or {@code ::+} suffix on their value.
     */
    public static final class Flag extends Node {
        public static final String DELIMITER_SEPARATOR = "::";

        public Flag(String value, Span span) {
            super(value, span);
        }

        public Flag(String value) {
            this(value, null);
        }

        /** The flag spelling without any embedded-command delimiter. */
        public String flagName() {
            int sep = value().indexOf(DELIMITER_SEPARATOR);
            return sep < 0 ? value() : value().substring(0, sep);
        }

        /** The recorded embedded-command delimiter, or {@code null}. */
        public String delimiter() {
            int sep = value().indexOf(DELIMITER_SEPARATOR);
            return sep < 0 ? null : value().substring(sep + DELIMITER_SEPARATOR.length());
        }

        public void recordDelimiter(String delimiter) {
            setValue(flagName() + DELIMITER_SEPARATOR + delimiter);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FLAG;
        }

        @Override
        protected Node copyNode() {
            return new Flag(value(), span());
        }
    }

    public static final class Argument extends Node {
        private final ArgType argType;

        public Argument(String value, ArgType argType, Span span) {
            super(value, span);
            this.argType = argType;
        }

        public Argument(String value, ArgType argType) {
            this(value, argType, null);
        }

        /** Semantic type, or {@code null} when never classified. */
        public ArgType argType() {
            return argType;
        }

        public boolean isReservedWord() {
            return argType == ArgType.RESERVED_WORD;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARGUMENT;
        }

        @Override
        protected Node copyNode() {
            return new Argument(value(), argType, span());
        }
    }

    public static final class UnaryLogicOp extends Node {
        private final Associativity associativity;

        public UnaryLogicOp(String value, Associativity associativity) {
            super(value, null);
            this.associativity = Objects.requireNonNull(associativity, "associativity");
        }

        /** Operator whose associativity follows from its spelling. */
        public UnaryLogicOp(String value) {
            this(value, LogicOperators.associativityOf(value));
        }

        public Associativity associativity() {
            return associativity;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UNARY_LOGIC_OP;
        }

        @Override
        protected Node copyNode() {
            return new UnaryLogicOp(value(), associativity);
        }
    }

    public static final class BinaryLogicOp extends Node {
        public BinaryLogicOp(String value) {
            super(value, null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BINARY_LOGIC_OP;
        }

        @Override
        protected Node copyNode() {
            return new BinaryLogicOp(value());
        }
    }
}
