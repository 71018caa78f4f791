package com.bashnorm.raw;

/**
 * Half-open character range [start, end) into the original command text.
 */
public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
