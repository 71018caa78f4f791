package com.bashnorm.output;

/**
 * Switches of surface token output.
 *
 * @param looseConstraints degrade gracefully on trees that break structural invariants
 * @param ignoreFlagOrder  emit a command's children sorted by value
 * @param argTypeOnly      emit argument types instead of argument values
 * @param withArgType      emit arguments as compound {@code ARGUMENT_value} symbols
 */
public record TokenOptions(boolean looseConstraints,
                           boolean ignoreFlagOrder,
                           boolean argTypeOnly,
                           boolean withArgType) {

    public static TokenOptions strict() {
        return new TokenOptions(false, false, false, false);
    }

    /** For model-generated trees that may be partially formed. */
    public static TokenOptions loose() {
        return new TokenOptions(true, false, false, false);
    }

    public TokenOptions withLooseConstraints(boolean value) {
        return new TokenOptions(value, ignoreFlagOrder, argTypeOnly, withArgType);
    }

    public TokenOptions withIgnoreFlagOrder(boolean value) {
        return new TokenOptions(looseConstraints, value, argTypeOnly, withArgType);
    }

    public TokenOptions withArgTypeOnly(boolean value) {
        return new TokenOptions(looseConstraints, ignoreFlagOrder, value, withArgType);
    }

    public TokenOptions withArgTypeSymbols(boolean value) {
        return new TokenOptions(looseConstraints, ignoreFlagOrder, argTypeOnly, value);
    }
}
