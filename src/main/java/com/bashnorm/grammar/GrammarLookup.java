package com.bashnorm.grammar;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Optional;

/**
 * Read-only view of the command grammar. Implementations are immutable after
 * construction and may be shared by concurrent normalizations.
 */
public interface GrammarLookup {

    /** Ordered positional argument slots of a command, empty for unknown commands. */
    ImmutableList<ArgSlot> argTypesFor(String headCommand);

    /** Argument type a flag expects, or empty if the flag takes no argument. */
    Optional<ArgType> flagArgTypeFor(String headCommand, String flag);

    boolean isLongOption(String token);

    /** Whether the command's arguments form a boolean predicate expression. */
    boolean isPredicateCommand(String headCommand);

    /** Whether clustered short options of the command are split. */
    boolean splitsFlags(String headCommand);

    /** Positional argument to insert when a command is given none. */
    Optional<String> implicitArgumentFor(String headCommand);
}
