package com.bashnorm.grammar;

/**
 * One positional argument slot of a command. A list slot accepts any number of
 * arguments and is never marked filled.
 */
public record ArgSlot(ArgType type, boolean list, boolean optional) {
    public static ArgSlot required(ArgType type) {
        return new ArgSlot(type, false, false);
    }

    public static ArgSlot list(ArgType type, boolean optional) {
        return new ArgSlot(type, true, optional);
    }
}
