package com.bashnorm.raw;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Builds parser-shaped trees from simple command strings for tests: words split
 * on whitespace with single/double quotes and backslash escapes removed from the
 * word text but kept in the span, {@code |} pipelines, and {@code $(...)},
 * {@code <(...)}, {@code >(...)} substitutions.
 */
public final class RawTrees {
    private RawTrees() {}

    public static RawNode parse(String source) {
        return parse(source, 0, source.length());
    }

    public static ParsedCommand parsed(String source) {
        return ParsedCommand.parsed(source, parse(source));
    }

    private static RawNode parse(String source, int from, int to) {
        MutableList<MutableList<RawNode>> commands = Lists.mutable.empty();
        commands.add(Lists.mutable.empty());
        MutableList<Span> pipes = Lists.mutable.empty();

        int i = from;
        while (i < to) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '|') {
                pipes.add(new Span(i, i + 1));
                commands.add(Lists.mutable.empty());
                i++;
                continue;
            }

            int start = i;
            StringBuilder text = new StringBuilder();
            RawNode substitution = null;
            while (i < to && !Character.isWhitespace(source.charAt(i)) && source.charAt(i) != '|') {
                char ch = source.charAt(i);
                if (ch == '\'' || ch == '"') {
                    int close = source.indexOf(ch, i + 1);
                    text.append(source, i + 1, close);
                    i = close + 1;
                } else if (ch == '\\' && i + 1 < to) {
                    text.append(source.charAt(i + 1));
                    i += 2;
                } else if ((ch == '$' || ch == '<' || ch == '>') && i + 1 < to && source.charAt(i + 1) == '(') {
                    int close = matchingParenthesis(source, i + 1);
                    RawKind kind = ch == '$' ? RawKind.COMMANDSUBSTITUTION : RawKind.PROCESSSUBSTITUTION;
                    RawNode inner = parse(source, i + 2, close);
                    substitution = new RawNode(kind, source.substring(i, close + 1), new Span(i, close + 1),
                            Lists.immutable.empty(), inner);
                    text.append(source, i, close + 1);
                    i = close + 1;
                } else {
                    text.append(ch);
                    i++;
                }
            }

            Span span = new Span(start, i);
            RawNode word = substitution == null
                    ? RawNode.word(text.toString(), span)
                    : new RawNode(RawKind.WORD, text.toString(), span, Lists.immutable.of(substitution), null);
            commands.getLast().add(word);
        }

        if (pipes.isEmpty()) {
            return command(commands.getFirst());
        }
        MutableList<RawNode> parts = Lists.mutable.empty();
        for (int c = 0; c < commands.size(); c++) {
            if (c > 0) {
                parts.add(new RawNode(RawKind.PIPE, "|", pipes.get(c - 1), Lists.immutable.empty(), null));
            }
            parts.add(command(commands.get(c)));
        }
        return new RawNode(RawKind.PIPELINE, "", null, parts.toImmutable(), null);
    }

    private static RawNode command(MutableList<RawNode> words) {
        Span span = words.isEmpty() ? null : new Span(words.getFirst().pos().start(), words.getLast().pos().end());
        return new RawNode(RawKind.COMMAND, "", span, words.toImmutable(), null);
    }

    private static int matchingParenthesis(String source, int open) {
        int depth = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new IllegalArgumentException("Unbalanced substitution in: " + source);
    }
}
