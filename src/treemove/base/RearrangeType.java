package treemove.base;

/**
 * Kinds of topological rearrangements that can be rolled back.
 */
public enum RearrangeType {
    SPR("Subtree prune and regraft");

    private String label;

    private RearrangeType(String label) {
        this.label = label;
    }

    public String toString() {
        return label;
    }
}
