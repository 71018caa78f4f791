package com.bashnorm.tree;

import java.util.Optional;

public enum NodeKind {
    ROOT("ROOT"),
    PIPELINE("PIPELINE"),
    COMMAND_SUBSTITUTION("COMMANDSUBSTITUTION"),
    PROCESS_SUBSTITUTION("PROCESSSUBSTITUTION"),
    HEAD_COMMAND("HEADCOMMAND"),
    FLAG("FLAG"),
    ARGUMENT("ARGUMENT"),
    UNARY_LOGIC_OP("UNARYLOGICOP"),
    BINARY_LOGIC_OP("BINARYLOGICOP");

    private final String symbolPrefix;

    NodeKind(String symbolPrefix) {
        this.symbolPrefix = symbolPrefix;
    }

    /** Prefix of the node's symbol in the encoded token stream. */
    public String symbolPrefix() {
        return symbolPrefix;
    }

    public static Optional<NodeKind> fromSymbolPrefix(String prefix) {
        for (NodeKind kind : values()) {
            if (kind.symbolPrefix.equals(prefix)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
