package treemove.base;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the nodes of a rooted tree lying within a range of topological distances
 * (number of edges) from a reference node.
 */
public final class NodeDistance {

    private NodeDistance() {
    }

    /**
     * Collects every node whose distance from {@code reference} is between {@code minDistance} and
     * {@code maxDistance}, both inclusive. The reference itself has distance 0.
     * <p>
     * Nodes are listed in this order: the subtree of {@code reference} in preorder, then for each
     * ancestor, the ancestor followed by the subtree of the sister of the node the path came from.
     *
     * @throws TreeException with {@link TreeError#INVALID_RANGE} if {@code maxDistance < minDistance},
     *                       or with {@link TreeError#INVALID_TREE} if the path to the root is broken
     */
    public static List<RootedNode> nodesAtDistance(RootedNode reference, int minDistance, int maxDistance) {
        if (maxDistance < minDistance)
            throw new TreeException(TreeError.INVALID_RANGE, "Invalid distance range: "
                    + minDistance + ".." + maxDistance + " (max_distance < min_distance)");

        // distances are never negative, a lower bound below 0 means 0
        if (minDistance < 0)
            minDistance = 0;

        List<RootedNode> nodes = new ArrayList<RootedNode>();
        collectDown(reference, nodes, minDistance, maxDistance);

        RootedNode current = reference;
        while (current.parent != null && maxDistance > 0) {
            RootedNode sister = TreeOperations.getSister(current).getSister().get();

            --minDistance;
            --maxDistance;

            current = current.parent;
            if (minDistance <= 0)
                nodes.add(current);
            if (sister != null)
                collectDown(sister, nodes, minDistance - 1, maxDistance - 1);
        }
        return nodes;
    }

    /**
     * Same as {@link #nodesAtDistance(RootedNode, int, int)}, writing into a caller supplied buffer.
     * Nothing is written if the range is invalid or the buffer is too small.
     * @return the number of nodes written to {@code out}
     */
    public static int nodesAtDistance(RootedNode reference, int minDistance, int maxDistance, RootedNode[] out) {
        List<RootedNode> nodes = nodesAtDistance(reference, minDistance, maxDistance);
        if (nodes.size() > out.length)
            throw new IllegalArgumentException("Buffer of size " + out.length + " cannot hold "
                    + nodes.size() + " nodes");
        for (int i = 0; i < nodes.size(); i++)
            out[i] = nodes.get(i);
        return nodes.size();
    }

    // distances are relative to `node'
    private static void collectDown(RootedNode node, List<RootedNode> nodes, int minDistance, int maxDistance) {
        if (maxDistance < 0)
            return;

        if (minDistance <= 0)
            nodes.add(node);

        if (node.left == null || node.right == null)
            return;

        collectDown(node.left, nodes, minDistance - 1, maxDistance - 1);
        collectDown(node.right, nodes, minDistance - 1, maxDistance - 1);
    }
}
