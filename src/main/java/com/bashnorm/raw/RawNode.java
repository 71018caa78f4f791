package com.bashnorm.raw;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * One node of the external parser's tree.
 *
 * @param kind    syntactic kind
 * @param word    literal (already unquoted) text, empty for structural nodes
 * @param pos     source offsets, or {@code null} for synthesized nodes
 * @param parts   ordered child parts
 * @param command inner command of a command or process substitution part
 */
public record RawNode(RawKind kind, String word, Span pos, ImmutableList<RawNode> parts, RawNode command) {
    public RawNode {
        word = word == null ? "" : word;
        parts = parts == null ? Lists.immutable.empty() : parts;
    }

    public static RawNode word(String word, Span pos) {
        return new RawNode(RawKind.WORD, word, pos, Lists.immutable.empty(), null);
    }

    public static RawNode of(RawKind kind, String word, Span pos, RawNode... parts) {
        return new RawNode(kind, word, pos, Lists.immutable.of(parts), null);
    }

    /** A synthesized command node holding a run of words sliced out of another command. */
    public static RawNode command(ImmutableList<RawNode> parts) {
        return new RawNode(RawKind.COMMAND, "", null, parts, null);
    }

    public RawNode withWord(String newWord) {
        return new RawNode(kind, newWord, pos, parts, command);
    }

    public RawNode withoutPos() {
        return new RawNode(kind, word, null, parts, command);
    }

    public boolean hasParts() {
        return !parts.isEmpty();
    }
}
