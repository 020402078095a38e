package treemove.base;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subtree prune and regraft (SPR) moves on a rooted binary tree, and their rollback.
 * <p>
 * A move prunes the subtree below a node together with the node's parent, and reinserts the
 * parent on the edge above the regraft target. All checks that do not depend on the pruned state
 * are made before the tree is touched. If the regraft step fails anyway, a
 * {@link PartialMoveException} is thrown and the tree is either restored or left pruned, as
 * configured in {@link MoveSettings#restoreOnFailedRegraft}.
 */
public class SprMove {

    private static final Logger LOG = Logger.getLogger(SprMove.class.getName());

    private final MoveSettings settings;

    public SprMove() {
        this(MoveSettings.defaults());
    }

    public SprMove(MoveSettings settings) {
        this.settings = settings;
    }

    public MoveSettings getSettings() {
        return settings;
    }

    /**
     * Performs one SPR move.
     *
     * @param pruneNode the root of the subtree to move
     * @param regraftTarget the node below the edge to regraft onto
     * @param tree holder of the tree root, updated if the root changes; may be null
     * @param wantRollback whether to return the information needed to undo the move
     * @return the rollback record, or null if {@code wantRollback} is false
     */
    public RollbackRecord apply(RootedNode pruneNode, RootedNode regraftTarget, RootedTree tree,
                                boolean wantRollback) {
        if (pruneNode.parent == null)
            throw new TreeException(TreeError.INVALID_NODE, "Attempting to prune the root node");

        RootedNode sister = TreeOperations.getSister(pruneNode).getSister().get();
        if (regraftTarget == pruneNode.parent || pruneNode.isAncestorOf(regraftTarget))
            throw new TreeException(TreeError.INVALID_NODE,
                    "Cannot regraft " + pruneNode + " onto " + regraftTarget + " inside the pruned subtree");

        // save rollback information
        RollbackRecord rollback = null;
        if (wantRollback)
            rollback = new RollbackRecord(RearrangeType.SPR, true, pruneNode, sister);

        RootedNode connected = TreeOperations.prune(pruneNode);
        try {
            TreeOperations.regraft(pruneNode, regraftTarget);
        } catch (TreeException e) {
            throw recover(pruneNode, sister, connected, tree, e);
        }

        // reset root in case it has changed
        if (tree != null)
            tree.resetRoot();

        if (LOG.isLoggable(Level.FINE))
            LOG.fine("SPR moved " + pruneNode + " onto " + regraftTarget);
        return rollback;
    }

    /**
     * Undoes a move previously applied with {@link #apply}. Only the topology is restored,
     * see {@link RollbackRecord#hasBranchLengths()}.
     *
     * @param rollback the record returned when the move was applied
     * @param tree holder of the tree root, updated if the root changes; may be null
     */
    public void rollback(RollbackRecord rollback, RootedTree tree) {
        if (rollback.getType() != RearrangeType.SPR || !rollback.isRooted())
            throw new TreeException(TreeError.INVALID_NODE, "Cannot roll back " + rollback + " on a rooted tree");

        apply(rollback.getPruneEdge(), rollback.getRegraftEdge(), tree, false);
        if (LOG.isLoggable(Level.FINE))
            LOG.fine("Rolled back " + rollback);
    }

    private PartialMoveException recover(RootedNode pruneNode, RootedNode sister, RootedNode connected,
                                         RootedTree tree, TreeException cause) {
        boolean restored = false;
        if (settings.restoreOnFailedRegraft) {
            try {
                TreeOperations.regraft(pruneNode, sister);
                restored = true;
                if (tree != null)
                    tree.resetRoot();
            } catch (TreeException e) {
                cause.addSuppressed(e);
            }
        }
        LOG.warning("Regraft of " + pruneNode + " failed after prune ("
                + cause.getMessage() + "), tree " + (restored ? "restored" : "left pruned"));
        return new PartialMoveException(pruneNode, pruneNode.parent, connected, restored, cause);
    }
}
