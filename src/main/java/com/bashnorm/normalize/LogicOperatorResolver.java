package com.bashnorm.normalize;

import com.bashnorm.error.Diagnostic;
import com.bashnorm.error.NormalizationException;
import com.bashnorm.tree.Associativity;
import com.bashnorm.tree.LogicOperators;
import com.bashnorm.tree.Node;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Turns the flat child list of a predicate-style command ({@code find}) into an
 * expression tree.
 *
 * <p>Parenthesized groups are collected on an explicit stack; a group resolves
 * when its closing parenthesis is reached, so inner groups always resolve before
 * the operators around them. Within a run, unary operators adopt their operand
 * first, then binary operators adopt both neighbours ({@code -and} before
 * {@code -or}, runs of the same operator flattened into one node). A group left
 * with several operands and no operator joining them becomes an implicit
 * {@code -and}.
 *
 * <p>Unmatched {@code )} is dropped and unmatched {@code (} is closed at the end
 * of the list; both are reported as repairs.
 */
public final class LogicOperatorResolver {
    private static final Logger logger = LoggerFactory.getLogger(LogicOperatorResolver.class);

    public static final String OPEN = "(";
    public static final String CLOSE = ")";

    /**
     * Resolves the children of {@code head} in place.
     *
     * @throws NormalizationException if an operator has no operand to adopt
     */
    public void resolve(Node.HeadCommand head, MutableList<Diagnostic> diagnostics) {
        MutableList<Node> items = head.removeAllChildren();
        Deque<MutableList<Node>> enclosing = new ArrayDeque<>();
        MutableList<Node> run = Lists.mutable.empty();

        for (Node item : items) {
            if (isParenthesis(item, OPEN)) {
                enclosing.push(run);
                run = Lists.mutable.empty();
            } else if (isParenthesis(item, CLOSE)) {
                if (enclosing.isEmpty()) {
                    diagnostics.add(Diagnostic.repair("dropped unmatched ')' in " + head.value()));
                    continue;
                }
                run = closeGroup(run, enclosing.pop());
            } else {
                run.add(item);
            }
        }

        while (!enclosing.isEmpty()) {
            diagnostics.add(Diagnostic.repair("closed unmatched '(' in " + head.value()));
            run = closeGroup(run, enclosing.pop());
        }

        resolveRun(run);
        run.each(head::addChild);
        collapseSingleOperands(head);
    }

    private MutableList<Node> closeGroup(MutableList<Node> group, MutableList<Node> outer) {
        resolveRun(group);
        if (group.isEmpty()) {
            logger.debug("resolver.group.empty");
        } else if (group.size() == 1) {
            outer.add(group.getFirst());
        } else {
            Node.BinaryLogicOp conjunction = new Node.BinaryLogicOp(LogicOperators.AND);
            group.each(conjunction::addChild);
            outer.add(conjunction);
        }
        return outer;
    }

    /** Resolves the operators of one bracket-free run in place. */
    void resolveRun(MutableList<Node> run) {
        resolveRightUnary(run);
        resolveLeftUnary(run);
        resolveBinary(run, 2);
        resolveBinary(run, 1);
    }

    private void resolveRightUnary(MutableList<Node> run) {
        for (int i = run.size() - 1; i >= 0; i--) {
            if (!(run.get(i) instanceof Node.UnaryLogicOp op)
                    || op.associativity() != Associativity.RIGHT || op.hasChildren()) {
                continue;
            }
            if (i + 1 >= run.size()) {
                throw NormalizationException.structural("unary logic operator " + op.value() + " without an operand");
            }
            Node operand = run.get(i + 1);
            if (isPendingBinary(operand)) {
                throw NormalizationException.structural(
                        "unary logic operator " + op.value() + " followed by " + operand.value());
            }
            run.remove(i + 1);
            op.addChild(operand);
        }
    }

    private void resolveLeftUnary(MutableList<Node> run) {
        for (int i = 0; i < run.size(); i++) {
            if (!(run.get(i) instanceof Node.UnaryLogicOp op)
                    || op.associativity() != Associativity.LEFT || op.hasChildren()) {
                continue;
            }
            // -prune at the start of an expression or right after an operator stands alone
            if (i == 0 || isPendingBinary(run.get(i - 1))) {
                continue;
            }
            Node operand = run.remove(i - 1);
            op.addChild(operand);
            i--;
        }
    }

    private void resolveBinary(MutableList<Node> run, int precedence) {
        int i = 0;
        while (i < run.size()) {
            Node node = run.get(i);
            if (!isPendingBinary(node) || LogicOperators.precedenceOf(node.value()) != precedence) {
                i++;
                continue;
            }
            if (i == 0 || i + 1 >= run.size()) {
                throw NormalizationException.structural(
                        "binary logic operator " + node.value() + " must have both left and right operands");
            }
            Node left = run.get(i - 1);
            Node right = run.get(i + 1);
            if (isPendingBinary(left) || isPendingBinary(right)) {
                throw NormalizationException.structural(
                        "adjacent binary logic operators around " + node.value());
            }

            run.remove(i + 1);
            run.remove(i);
            if (left instanceof Node.BinaryLogicOp && left.value().equals(node.value())) {
                left.removeAllChildren().each(node::addChild);
            } else {
                node.addChild(left);
            }
            node.addChild(right);
            run.set(i - 1, node);
        }
    }

    /** Replaces every binary operator with a single operand by that operand. */
    private void collapseSingleOperands(Node node) {
        for (Node child : node.children().toList()) {
            collapseSingleOperands(child);
            if (child instanceof Node.BinaryLogicOp && child.numChildren() == 1) {
                node.replaceChild(child, child.firstChild());
            }
        }
    }

    private static boolean isPendingBinary(Node node) {
        return node instanceof Node.BinaryLogicOp && !node.hasChildren();
    }

    static boolean isParenthesis(Node node, String paren) {
        return node instanceof Node.Argument && !node.hasChildren() && paren.equals(node.value());
    }
}
