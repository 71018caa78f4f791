package com.bashnorm.output;

import com.bashnorm.error.NormalizationException;
import com.bashnorm.grammar.ArgSlot;
import com.bashnorm.grammar.ArgType;
import com.bashnorm.grammar.GrammarLookup;
import com.bashnorm.normalize.ArgumentClassifier;
import com.bashnorm.tree.Associativity;
import com.bashnorm.tree.Node;
import com.bashnorm.tree.NodeKind;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Converts canonical trees to token sequences and back.
 *
 * <p>{@link #toTokens} produces the surface tokens of a command
 * ({@code find . \( -name x -or -name y \)}). {@link #encode} produces the
 * prefix symbol stream ({@code HEADCOMMAND_find}, ..., {@value #POP}) that
 * {@link #decode} turns back into a tree.
 */
public class TokenCodec {
    private static final Logger logger = LoggerFactory.getLogger(TokenCodec.class);

    /** Returns the decoding cursor to its parent. */
    public static final String POP = "<NO_EXPAND>";
    public static final String OPEN_GROUP = "\\(";
    public static final String CLOSE_GROUP = "\\)";

    private final GrammarLookup grammar;

    public TokenCodec(GrammarLookup grammar) {
        this.grammar = grammar;
    }

    /**
     * Surface tokens of {@code tree}.
     *
     * @throws NormalizationException in strict mode, if the tree breaks a structural invariant
     */
    public MutableList<String> toTokens(Node tree, TokenOptions options) {
        MutableList<String> tokens = Lists.mutable.empty();
        if (tree != null) {
            emit(tree, options, tokens);
        }
        return tokens;
    }

    public String toCommand(Node tree, TokenOptions options) {
        return toTokens(tree, options).makeString(" ");
    }

    private void emit(Node node, TokenOptions options, MutableList<String> tokens) {
        boolean loose = options.looseConstraints();
        if (!loose) {
            requireWellFormed(node);
        }

        switch (node.kind()) {
            case ROOT -> {
                if (loose) {
                    emitAll(node.children(), options, tokens);
                } else {
                    emit(node.firstChild(), options, tokens);
                }
            }
            case PIPELINE -> {
                if (node.numChildren() == 0) {
                    tokens.add("|");
                    return;
                }
                for (int i = 0; i < node.numChildren(); i++) {
                    if (i > 0) {
                        tokens.add("|");
                    }
                    emit(node.child(i), options, tokens);
                }
            }
            case COMMAND_SUBSTITUTION -> {
                tokens.add("$(");
                emitAll(node.children(), options, tokens);
                tokens.add(")");
            }
            case PROCESS_SUBSTITUTION -> {
                tokens.add(node.value() + "(");
                emitAll(node.children(), options, tokens);
                tokens.add(")");
            }
            case HEAD_COMMAND -> {
                tokens.add(node.value());
                ListIterable<Node> children = options.ignoreFlagOrder()
                        ? node.children().toSortedListBy(Node::value)
                        : node.children();
                emitAll(children, options, tokens);
            }
            case FLAG -> {
                Node.Flag flag = (Node.Flag) node;
                tokens.add(flag.flagName());
                emitAll(node.children(), options, tokens);
                String delimiter = flag.delimiter();
                if (delimiter != null) {
                    tokens.add(";".equals(delimiter) ? "\\;" : delimiter);
                }
            }
            case BINARY_LOGIC_OP -> {
                if (node.numChildren() < 2) {
                    emitAll(node.children(), options, tokens);
                    return;
                }
                tokens.add(OPEN_GROUP);
                for (int i = 0; i < node.numChildren(); i++) {
                    if (i > 0) {
                        tokens.add(node.value());
                    }
                    emit(node.child(i), options, tokens);
                }
                tokens.add(CLOSE_GROUP);
            }
            case UNARY_LOGIC_OP -> {
                Node.UnaryLogicOp op = (Node.UnaryLogicOp) node;
                if (op.associativity() == Associativity.RIGHT) {
                    tokens.add(op.value());
                    emitAll(op.children(), options, tokens);
                } else {
                    emitAll(op.children(), options, tokens);
                    tokens.add(op.value());
                }
            }
            case ARGUMENT -> {
                tokens.add(argumentToken((Node.Argument) node, options));
                if (loose) {
                    emitAll(node.children(), options, tokens);
                }
            }
        }
    }

    private void emitAll(ListIterable<Node> nodes, TokenOptions options, MutableList<String> tokens) {
        for (Node node : nodes) {
            emit(node, options, tokens);
        }
    }

    private String argumentToken(Node.Argument argument, TokenOptions options) {
        if (options.withArgType()) {
            return argument.symbol();
        }
        if (options.argTypeOnly() && !argument.isReservedWord()) {
            ArgType type = argument.argType();
            return type == null ? ArgType.UNKNOWN.typeName() : type.typeName();
        }
        return argument.value();
    }

    private static void requireWellFormed(Node node) {
        String violation = switch (node.kind()) {
            case ROOT -> node.numChildren() == 1 ? null : "root must have exactly one child";
            case PIPELINE -> node.numChildren() > 1 ? null : "pipeline must have at least two commands";
            case COMMAND_SUBSTITUTION, PROCESS_SUBSTITUTION ->
                    node.numChildren() == 1 ? null : "substitution must wrap exactly one command";
            case BINARY_LOGIC_OP -> node.numChildren() > 1 ? null : "binary operator needs two operands";
            case UNARY_LOGIC_OP -> {
                boolean right = ((Node.UnaryLogicOp) node).associativity() == Associativity.RIGHT;
                yield (right ? node.numChildren() == 1 : node.numChildren() <= 1)
                        ? null : "unary operator " + node.value() + " needs one operand";
            }
            case ARGUMENT -> node.hasChildren() ? "argument cannot have children" : null;
            case HEAD_COMMAND, FLAG -> null;
        };
        if (violation != null) {
            throw NormalizationException.structural(violation + ": " + node.symbol());
        }
    }

    /**
     * Prefix symbol stream of {@code tree}: each node's symbol, then its
     * children, then {@link #POP}.
     *
     * @throws NormalizationException if the tree breaks a structural invariant
     */
    public MutableList<String> encode(Node tree) {
        MutableList<String> symbols = Lists.mutable.empty();
        encode(tree, symbols);
        return symbols;
    }

    private void encode(Node node, MutableList<String> symbols) {
        requireWellFormed(node);
        symbols.add(node.symbol());
        for (Node child : node.children()) {
            encode(child, symbols);
        }
        symbols.add(POP);
    }

    /**
     * Rebuilds a tree from a prefix symbol stream, which may come from a model and
     * be malformed. Argument types are derived again from the grammar. Decoding
     * stops when the cursor pops past the root; unrecognized symbols become
     * Unknown arguments.
     */
    public Node.Root decode(List<String> symbols) {
        Node.Root root = new Node.Root();
        Node current = root;
        int start = !symbols.isEmpty() && root.symbol().equals(symbols.get(0)) ? 1 : 0;

        for (int i = start; i < symbols.size() && current != null; i++) {
            String symbol = symbols.get(i);
            if (POP.equals(symbol)) {
                current = current.parent();
                continue;
            }
            Node node = decodeSymbol(symbol, current);
            current.addChild(node);
            current = node;
        }
        return root;
    }

    private Node decodeSymbol(String symbol, Node current) {
        int sep = symbol.indexOf('_');
        Optional<NodeKind> kind = sep < 0 ? Optional.empty() : NodeKind.fromSymbolPrefix(symbol.substring(0, sep));
        if (kind.isEmpty()) {
            logger.warn("decode.symbol.unrecognized symbol={}", symbol);
            return new Node.Argument(symbol, ArgType.UNKNOWN);
        }

        String value = symbol.substring(sep + 1);
        return switch (kind.get()) {
            case ROOT -> new Node.Root();
            case PIPELINE -> new Node.Pipeline();
            case COMMAND_SUBSTITUTION -> new Node.CommandSubstitution();
            case PROCESS_SUBSTITUTION -> new Node.ProcessSubstitution(">".equals(value) ? ">" : "<");
            case HEAD_COMMAND -> new Node.HeadCommand(value);
            case FLAG -> new Node.Flag(value);
            case ARGUMENT -> new Node.Argument(value, argumentType(value, current));
            case UNARY_LOGIC_OP -> new Node.UnaryLogicOp(value);
            case BINARY_LOGIC_OP -> new Node.BinaryLogicOp(value);
        };
    }

    private ArgType argumentType(String value, Node attachPoint) {
        if (attachPoint instanceof Node.Flag flag) {
            Node.HeadCommand head = flag.headCommand();
            if (head == null) {
                return ArgType.UNKNOWN;
            }
            return grammar.flagArgTypeFor(head.value(), flag.flagName()).orElse(ArgType.UNKNOWN);
        }
        Node.HeadCommand head = attachPoint.headCommand();
        if (head == null) {
            logger.warn("decode.argument.unattached value={} attachPoint={}", value, attachPoint.symbol());
            return ArgType.UNKNOWN;
        }
        return ArgumentClassifier.classify(value,
                grammar.argTypesFor(head.value()).collect(ArgSlot::type).toSet());
    }
}
