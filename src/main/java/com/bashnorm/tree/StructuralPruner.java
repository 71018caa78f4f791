package com.bashnorm.tree;

/**
 * Strips argument values from a canonical tree so commands can be compared by
 * structure alone.
 */
public final class StructuralPruner {
    private StructuralPruner() {}

    /**
     * Returns a copy of {@code tree} without Argument nodes, except reserved words
     * such as {@code {}} and {@code ;}. The input is not modified.
     */
    public static Node prune(Node tree) {
        if (tree == null) {
            return null;
        }
        Node copy = tree.deepCopy();
        pruneInPlace(copy);
        return copy;
    }

    private static void pruneInPlace(Node node) {
        for (Node child : node.children().toList()) {
            if (child instanceof Node.Argument arg && !arg.isReservedWord()) {
                node.removeChild(child);
            } else {
                pruneInPlace(child);
            }
        }
    }
}
