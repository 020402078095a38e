package treemove.base;

/**
 * A reference to the child cell of a parent node that holds a given node:
 * either nothing (the node is a root), the left cell or the right cell of a parent.
 * Writing through a link only rewrites the parent's child reference, never a parent reference.
 */
public final class NodeLink {

    public enum Kind {
        NONE, LEFT, RIGHT
    }

    /** The link of a root: there is no cell referencing it. */
    public static final NodeLink NONE = new NodeLink(Kind.NONE, null);

    private final Kind kind;
    private final RootedNode parent;

    private NodeLink(Kind kind, RootedNode parent) {
        this.kind = kind;
        this.parent = parent;
    }

    static NodeLink leftOf(RootedNode parent) {
        return new NodeLink(Kind.LEFT, parent);
    }

    static NodeLink rightOf(RootedNode parent) {
        return new NodeLink(Kind.RIGHT, parent);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }

    /**
     * @return the node owning the cell, null for {@link #NONE}
     */
    public RootedNode getParent() {
        return parent;
    }

    /**
     * @return the node currently stored in the cell
     */
    public RootedNode get() {
        switch (kind) {
            case LEFT:
                return parent.left;
            case RIGHT:
                return parent.right;
            default:
                return null;
        }
    }

    void set(RootedNode node) {
        switch (kind) {
            case LEFT:
                parent.left = node;
                break;
            case RIGHT:
                parent.right = node;
                break;
            default:
                throw new IllegalStateException("Cannot write through an absent link");
        }
    }

    /**
     * @return the other child cell of the same parent
     */
    NodeLink opposite() {
        switch (kind) {
            case LEFT:
                return rightOf(parent);
            case RIGHT:
                return leftOf(parent);
            default:
                return NONE;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NodeLink))
            return false;
        NodeLink other = (NodeLink) o;
        return kind == other.kind && parent == other.parent;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + System.identityHashCode(parent);
    }

    @Override
    public String toString() {
        return kind == Kind.NONE ? "NONE" : kind + " of " + parent;
    }
}
