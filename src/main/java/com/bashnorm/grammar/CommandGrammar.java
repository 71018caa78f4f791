package com.bashnorm.grammar;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Grammar entry for a single utility.
 *
 * @param name             head command name
 * @param arguments        positional argument slots in order
 * @param flagArguments    argument type of every flag that takes an argument
 * @param predicate        arguments form a boolean expression (find-style)
 * @param splitFlags       clustered short options are split into single flags
 * @param implicitArgument positional argument inserted when none is given, or null
 */
public record CommandGrammar(String name,
                             ImmutableList<ArgSlot> arguments,
                             ImmutableMap<String, ArgType> flagArguments,
                             boolean predicate,
                             boolean splitFlags,
                             String implicitArgument) {
    public CommandGrammar {
        arguments = arguments == null ? Lists.immutable.empty() : arguments;
        flagArguments = flagArguments == null ? Maps.immutable.empty() : flagArguments;
    }

    public static CommandGrammar simple(String name, ImmutableList<ArgSlot> arguments,
                                        ImmutableMap<String, ArgType> flagArguments) {
        return new CommandGrammar(name, arguments, flagArguments, false, true, null);
    }
}
