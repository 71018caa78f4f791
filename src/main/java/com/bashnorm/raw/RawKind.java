package com.bashnorm.raw;

import java.util.Locale;

/**
 * Syntactic node kinds produced by the external shell parser.
 */
public enum RawKind {
    WORD,
    COMMAND,
    PIPELINE,
    PIPE,
    LIST,
    OPERATOR,
    REDIRECT,
    ASSIGNMENT,
    COMMANDSUBSTITUTION,
    PROCESSSUBSTITUTION,
    PARAMETER,
    TILDE,
    RESERVEDWORD,
    COMPOUND,
    FOR,
    IF,
    WHILE,
    UNTIL,
    FUNCTION,
    HEREDOC;

    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RawKind fromJsonName(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown parse node kind: " + name);
        }
    }
}
