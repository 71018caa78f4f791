package com.bashnorm.normalize;

import com.bashnorm.error.Diagnostic;
import com.bashnorm.error.ErrorKind;
import com.bashnorm.tree.Node;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Outcome of normalizing one command.
 */
public sealed interface NormalizeResult {

    /** A canonical tree, possibly repaired; {@code diagnostics} lists the repairs. */
    record Normalized(Node.Root tree, ImmutableList<Diagnostic> diagnostics) implements NormalizeResult {}

    /** The command was skipped. */
    record Failed(ErrorKind kind, String command, String message) implements NormalizeResult {}

    default boolean isNormalized() {
        return this instanceof Normalized;
    }

    /** The tree of a successful result; throws for failures. */
    default Node.Root tree() {
        if (this instanceof Normalized normalized) {
            return normalized.tree();
        }
        Failed failed = (Failed) this;
        throw new IllegalStateException("Normalization failed (" + failed.kind() + "): " + failed.message());
    }
}
