package com.bashnorm.normalize;

import com.bashnorm.raw.RawNode;
import com.bashnorm.raw.Span;

/**
 * Recovers the quoting a user wrote around a word from the original command text.
 */
final class QuoteRecovery {
    private QuoteRecovery() {}

    static boolean isQuoted(RawNode word, String source) {
        Span span = word.pos();
        if (span == null || source == null || span.length() == 0 || span.end() > source.length()) {
            return false;
        }
        return isQuote(source.charAt(span.start())) || isQuote(source.charAt(span.end() - 1));
    }

    /** The word as written when it was quoted, otherwise the parser's unquoted text. */
    static String recover(RawNode word, String source) {
        if (!isQuoted(word, source)) {
            return word.word();
        }
        Span span = word.pos();
        return source.substring(span.start(), span.end());
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
