package com.bashnorm.error;

public class NormalizationException extends RuntimeException {
    private final ErrorKind kind;

    public NormalizationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static NormalizationException unsupported(String message) {
        return new NormalizationException(ErrorKind.UNSUPPORTED_CONSTRUCT, "Unsupported: " + message);
    }

    public static NormalizationException structural(String message) {
        return new NormalizationException(ErrorKind.STRUCTURAL_INCONSISTENCY, message);
    }
}
