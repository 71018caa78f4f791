package com.bashnorm.error;

/**
 * Non-fatal note attached to a normalized command.
 */
public record Diagnostic(ErrorKind kind, String message) {
    public static Diagnostic repair(String message) {
        return new Diagnostic(ErrorKind.RECOVERABLE_REPAIR, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
