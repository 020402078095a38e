package treemove.base;

/**
 * Thrown by {@link SprMove} when the prune step succeeded but the regraft step failed.
 * Depending on {@link MoveSettings#restoreOnFailedRegraft} the fragment has either been put back
 * where it was pruned from, or the tree is still split in two: the remainder, reachable from
 * {@link #getConnectedNode()}, and the detached fragment {@link #getFragment()} carrying
 * {@link #getPrunedNode()} as its only child.
 */
public class PartialMoveException extends TreeException {

    private static final long serialVersionUID = 1L;

    private final transient RootedNode prunedNode;
    private final transient RootedNode fragment;
    private final transient RootedNode connectedNode;
    private final boolean treeRestored;

    PartialMoveException(RootedNode prunedNode, RootedNode fragment, RootedNode connectedNode,
                         boolean treeRestored, TreeException cause) {
        super(cause.getError(), "Regraft failed after prune"
                + (treeRestored ? ", the pruned subtree was put back" : ", the tree is left pruned"), cause);
        this.prunedNode = prunedNode;
        this.fragment = fragment;
        this.connectedNode = connectedNode;
        this.treeRestored = treeRestored;
    }

    public RootedNode getPrunedNode() {
        return prunedNode;
    }

    /** The detached node that was supposed to subdivide the regraft edge. */
    public RootedNode getFragment() {
        return fragment;
    }

    /** The node returned by the prune step. */
    public RootedNode getConnectedNode() {
        return connectedNode;
    }

    /**
     * @return true if the tree has its pre-move topology again, false if it is left pruned
     */
    public boolean isTreeRestored() {
        return treeRestored;
    }
}
