package treemove.base;

/**
 * The cell of the parent holding a node, and the cell holding its sister.
 * Both are {@link NodeLink#NONE} for a root.
 */
public final class SisterLinks {

    static final SisterLinks ROOT = new SisterLinks(NodeLink.NONE, NodeLink.NONE);

    private final NodeLink self;
    private final NodeLink sister;

    SisterLinks(NodeLink self, NodeLink sister) {
        this.self = self;
        this.sister = sister;
    }

    public NodeLink getSelf() {
        return self;
    }

    public NodeLink getSister() {
        return sister;
    }

    public boolean isRoot() {
        return !self.isPresent();
    }
}
