package com.bashnorm.raw;

/**
 * A command as delivered by the external parser: either its parse tree or the
 * reason the parser rejected it.
 */
public record ParsedCommand(String text, RawNode tree, String rejection) {
    public static ParsedCommand parsed(String text, RawNode tree) {
        return new ParsedCommand(text, tree, null);
    }

    public static ParsedCommand rejected(String text, String reason) {
        return new ParsedCommand(text, null, reason);
    }

    public boolean isRejected() {
        return tree == null;
    }
}
