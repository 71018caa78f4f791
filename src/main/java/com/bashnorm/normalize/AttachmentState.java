package com.bashnorm.normalize;

import com.bashnorm.grammar.ArgType;
import com.bashnorm.tree.Node;

import java.util.EnumSet;
import java.util.Set;

/**
 * Where the next word of a command attaches and what it may be.
 *
 * @param point    node the next word attaches to
 * @param kinds    node kinds the next word may become
 * @param argTypes argument types a flag expects; empty when positional slots decide
 */
record AttachmentState(Node point, Set<Expect> kinds, Set<ArgType> argTypes) {

    enum Expect {
        HEAD_COMMAND,
        FLAG,
        ARGUMENT
    }

    static AttachmentState headCommand(Node point) {
        return new AttachmentState(point, EnumSet.of(Expect.HEAD_COMMAND), EnumSet.noneOf(ArgType.class));
    }

    static AttachmentState flagsOrArguments(Node.HeadCommand head) {
        return new AttachmentState(head, EnumSet.of(Expect.FLAG, Expect.ARGUMENT), EnumSet.noneOf(ArgType.class));
    }

    /** After {@code --}: every word is a positional argument. */
    static AttachmentState argumentsOnly(Node.HeadCommand head) {
        return new AttachmentState(head, EnumSet.of(Expect.ARGUMENT), EnumSet.noneOf(ArgType.class));
    }

    static AttachmentState argumentOf(Node.Flag flag, ArgType type) {
        return new AttachmentState(flag, EnumSet.of(Expect.ARGUMENT), EnumSet.of(type));
    }

    boolean accepts(Expect kind) {
        return kinds.contains(kind);
    }

    boolean expectsHeadCommand() {
        return kinds.contains(Expect.HEAD_COMMAND);
    }

    boolean expectsFlagArgument() {
        return point instanceof Node.Flag;
    }
}
