package com.bashnorm.tree;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Operator vocabulary of predicate-style commands.
 */
public final class LogicOperators {
    public static final String AND = "-and";
    public static final String OR = "-or";

    private static final ImmutableSet<String> RIGHT_UNARY = Sets.immutable.of("!", "-not");
    private static final ImmutableSet<String> LEFT_UNARY = Sets.immutable.of("-prune");
    private static final ImmutableMap<String, String> BINARY_ALIASES = Maps.immutable.of(
            "-and", AND,
            "-a", AND,
            "-or", OR,
            "-o", OR);

    private LogicOperators() {}

    public static boolean isUnary(String word) {
        return RIGHT_UNARY.contains(word) || LEFT_UNARY.contains(word);
    }

    public static boolean isBinary(String word) {
        return BINARY_ALIASES.containsKey(word);
    }

    public static boolean isOperator(String word) {
        return isUnary(word) || isBinary(word);
    }

    /** Canonical spelling of a binary operator ({@code -o} becomes {@code -or}). */
    public static String canonicalBinary(String word) {
        String canonical = BINARY_ALIASES.get(word);
        return canonical != null ? canonical : word;
    }

    public static Associativity associativityOf(String word) {
        return LEFT_UNARY.contains(word) ? Associativity.LEFT : Associativity.RIGHT;
    }

    /** Higher binds tighter. */
    public static int precedenceOf(String binaryOperator) {
        return AND.equals(canonicalBinary(binaryOperator)) ? 2 : 1;
    }
}
