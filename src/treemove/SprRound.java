package treemove;

import treemove.base.MoveSettings;
import treemove.base.NodeDistance;
import treemove.base.RollbackRecord;
import treemove.base.RootedNode;
import treemove.base.RootedTree;
import treemove.base.SprMove;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * One round of SPR moves over a tree. Every non-root node is pruned in turn and regrafted onto
 * each edge within the configured radius of its parent; the rearranged tree is scored and the move
 * rolled back. At the end of the round the best move is applied if it beats the starting score.
 */
public class SprRound {

    private static final Logger LOG = Logger.getLogger(SprRound.class.getName());

    /**
     * Scores a tree topology, higher is better.
     */
    public interface Scorer {
        double score(RootedTree tree);
    }

    /**
     * Outcome of a round.
     */
    public static class Result {
        private final int movesTried;
        private final double startScore;
        private final double bestScore;
        private final RootedNode bestPrune;
        private final RootedNode bestTarget;

        Result(int movesTried, double startScore, double bestScore, RootedNode bestPrune, RootedNode bestTarget) {
            this.movesTried = movesTried;
            this.startScore = startScore;
            this.bestScore = bestScore;
            this.bestPrune = bestPrune;
            this.bestTarget = bestTarget;
        }

        public int getMovesTried() {
            return movesTried;
        }

        public double getStartScore() {
            return startScore;
        }

        public double getBestScore() {
            return bestScore;
        }

        /** The pruned node of the applied move, null if the tree was left unchanged. */
        public RootedNode getBestPrune() {
            return bestPrune;
        }

        public RootedNode getBestTarget() {
            return bestTarget;
        }

        public boolean isImproved() {
            return bestPrune != null;
        }
    }

    private final SprMove move;
    private final Scorer scorer;

    public SprRound(MoveSettings settings, Scorer scorer) {
        this.move = new SprMove(settings);
        this.scorer = scorer;
    }

    public Result run(RootedTree tree) {
        MoveSettings settings = move.getSettings();
        if (settings.maxRadius < settings.minRadius)
            throw new IllegalArgumentException("Invalid radius range: "
                    + settings.minRadius + ".." + settings.maxRadius);

        double startScore = scorer.score(tree);
        double bestScore = startScore;
        RootedNode bestPrune = null, bestTarget = null;
        int moves = 0;

        for (RootedNode source : pruneCandidates(tree.getRoot())) {
            for (RootedNode destination : getDestinations(source)) {
                RollbackRecord rollback = jump(source, destination, tree);
                moves++;
                double score = scorer.score(tree);
                restore(rollback, tree);

                if (score > bestScore) {
                    bestScore = score;
                    bestPrune = source;
                    bestTarget = destination;
                }
            }
        }

        if (bestPrune != null)
            move.apply(bestPrune, bestTarget, tree, false);

        LOG.info("SPR round tried " + moves + " moves, score " + startScore + " -> " + bestScore
                + (bestPrune != null ? " (moved " + bestPrune + " onto " + bestTarget + ")" : ""));
        return new Result(moves, startScore, bestScore, bestPrune, bestTarget);
    }

    private RollbackRecord jump(RootedNode source, RootedNode destination, RootedTree tree) {
        return move.apply(source, destination, tree, true);
    }

    private void restore(RollbackRecord rollback, RootedTree tree) {
        move.rollback(rollback, tree);
    }

    private List<RootedNode> pruneCandidates(RootedNode root) {
        List<RootedNode> nodes = new ArrayList<RootedNode>();
        addPreorder(root, nodes);
        nodes.remove(root);
        return nodes;
    }

    private void addPreorder(RootedNode node, List<RootedNode> nodes) {
        nodes.add(node);
        if (!node.isLeaf()) {
            addPreorder(node.getLeft(), nodes);
            addPreorder(node.getRight(), nodes);
        }
    }

    /**
     * Regraft targets around the parent of {@code source}, excluding the pruned subtree, the parent
     * and the sister, which would give back the same tree.
     */
    List<RootedNode> getDestinations(RootedNode source) {
        MoveSettings settings = move.getSettings();
        RootedNode parent = source.getParent();
        RootedNode sister = source.brother();
        List<RootedNode> destinations = new ArrayList<RootedNode>();
        for (RootedNode node : NodeDistance.nodesAtDistance(parent, settings.minRadius, settings.maxRadius)) {
            if (node == parent || node == sister || source.isAncestorOf(node))
                continue;
            destinations.add(node);
        }
        return destinations;
    }
}
