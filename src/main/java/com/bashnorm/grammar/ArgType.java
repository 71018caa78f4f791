package com.bashnorm.grammar;

/**
 * Semantic argument types. {@link #typeName()} is the spelling used by grammar
 * files and by argument-type token output.
 */
public enum ArgType {
    NUMBER("Number"),
    SIZE("Size"),
    TIME("Time"),
    PERMISSION("Permission"),
    PATTERN("Pattern"),
    FILE("File"),
    UTILITY("Utility"),
    RESERVED_WORD("ReservedWord"),
    UNKNOWN("Unknown");

    private final String typeName;

    ArgType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public static ArgType fromTypeName(String name) {
        for (ArgType type : values()) {
            if (type.typeName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown argument type: " + name);
    }
}
