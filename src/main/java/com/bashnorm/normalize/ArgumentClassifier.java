package com.bashnorm.normalize;

import com.bashnorm.grammar.ArgType;
import com.bashnorm.raw.Span;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Set;

/**
 * Lexical heuristics assigning a semantic type to an argument word.
 */
public final class ArgumentClassifier {
    private static final ImmutableSet<String> RESERVED_WORDS = Sets.immutable.of("+", ";", "{}");
    private static final String SIZE_SUFFIXES = "kMGTP";
    private static final String TIME_SUFFIXES = "smhdw";

    private ArgumentClassifier() {}

    public static ArgType classify(String word, Set<ArgType> allowed) {
        return classify(word, null, allowed);
    }

    /**
     * Classifies {@code word}, considering only the {@code allowed} types. A word
     * whose text is two characters shorter than its source span was quoted and
     * counts as a Pattern.
     *
     * @return the type, or {@link ArgType#UNKNOWN} if no heuristic applies
     */
    public static ArgType classify(String word, Span span, Set<ArgType> allowed) {
        if (RESERVED_WORDS.contains(word)) {
            return ArgType.RESERVED_WORD;
        }
        if (!word.isEmpty() && isAllDigits(word) && allowed.contains(ArgType.NUMBER)) {
            return ArgType.NUMBER;
        }
        boolean hasDigit = containsDigit(word);
        if (hasDigit) {
            char last = word.charAt(word.length() - 1);
            if (SIZE_SUFFIXES.indexOf(last) >= 0 && allowed.contains(ArgType.SIZE)) {
                return ArgType.SIZE;
            }
            if (TIME_SUFFIXES.indexOf(last) >= 0 && allowed.contains(ArgType.TIME)) {
                return ArgType.TIME;
            }
        }
        if (allowed.contains(ArgType.PERMISSION) && (hasDigit || word.indexOf('=') >= 0)) {
            return ArgType.PERMISSION;
        }
        if (allowed.contains(ArgType.PATTERN) && span != null && word.length() == span.length() - 2) {
            return ArgType.PATTERN;
        }
        if (allowed.contains(ArgType.FILE)) {
            return ArgType.FILE;
        }
        if (allowed.contains(ArgType.UTILITY)) {
            return ArgType.UTILITY;
        }
        return ArgType.UNKNOWN;
    }

    private static boolean isAllDigits(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean containsDigit(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (Character.isDigit(word.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
