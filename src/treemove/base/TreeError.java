package treemove.base;

/**
 * Kinds of failures reported by the tree operations.
 */
public enum TreeError {
    /** A parent and child disagree about their link. */
    INVALID_TREE("Invalid tree"),
    /** The operation was attempted on a node in the wrong structural role. */
    INVALID_NODE("Invalid node"),
    /** Malformed distance bounds. */
    INVALID_RANGE("Invalid range");

    private String label;

    private TreeError(String label) {
        this.label = label;
    }

    public String toString() {
        return label;
    }
}
