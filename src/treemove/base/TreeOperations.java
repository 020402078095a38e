package treemove.base;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pruning and regrafting of subtrees in a rooted binary tree.
 * Every operation validates the nodes it is going to touch before the first write,
 * so a {@link TreeException} always leaves the tree as it was.
 */
public final class TreeOperations {

    private static final Logger LOG = Logger.getLogger(TreeOperations.class.getName());

    private TreeOperations() {
    }

    /**
     * Finds the cell of the parent that references {@code node} and the cell referencing its sister.
     * @param node any node
     * @return the two links, both absent if {@code node} is a root
     * @throws TreeException with {@link TreeError#INVALID_TREE} if the parent of {@code node}
     *                       does not reference it
     */
    public static SisterLinks getSister(RootedNode node) {
        RootedNode parent = node.parent;
        if (parent == null)
            return SisterLinks.ROOT;
        if (parent.left == node)
            return new SisterLinks(NodeLink.leftOf(parent), NodeLink.rightOf(parent));
        if (parent.right == node)
            return new SisterLinks(NodeLink.rightOf(parent), NodeLink.leftOf(parent));
        // `node' is neither the left nor the right child of its parent
        throw new TreeException(TreeError.INVALID_TREE, "Tree is not consistent: " + node
                + " is not a child of its parent " + parent);
    }

    /**
     * Prunes the subtree below {@code node}. The parent of {@code node} becomes a detached node
     * whose only child is {@code node}, and the sister of {@code node} takes the place of the parent.
     *
     * @param node root of the subtree to prune, must not be the root of the tree
     * @return the grandparent of {@code node} if it had one, otherwise the former sister which is now
     *         the root of the remaining tree
     */
    public static RootedNode prune(RootedNode node) {
        if (node.parent == null)
            throw new TreeException(TreeError.INVALID_NODE, "Attempting to prune the root node");

        NodeLink sisterLink = getSister(node).getSister();
        RootedNode sister = sisterLink.get();
        RootedNode parent = node.parent;
        if (sister == null)
            throw new TreeException(TreeError.INVALID_TREE, "Node " + node + " has no sister");

        RootedNode connected;
        if (parent.parent != null) {
            // connect grandparent and sister
            NodeLink parentLink = getSister(parent).getSelf();
            connected = parent.parent;

            parentLink.set(sister);
            sister.parent = connected;

            // disconnect pruned tree
            sisterLink.set(null);
            parent.parent = null;
        } else {
            // sister becomes the root of the remaining tree
            connected = sister;
            sisterLink.set(null);
            sister.parent = null;
        }

        if (LOG.isLoggable(Level.FINE))
            LOG.fine("Pruned " + node + ", remaining tree reconnected at " + connected);
        return connected;
    }

    /**
     * Regrafts a pruned subtree onto the edge above {@code target}. The detached parent of
     * {@code node} is inserted between {@code target} and its parent, or becomes the new root
     * if {@code target} is a root.
     *
     * @param node a node whose parent is detached and has no other child, as left by {@link #prune}
     * @param target the node below the edge to subdivide
     */
    public static void regraft(RootedNode node, RootedNode target) {
        // node must have a detached parent
        if (node.parent == null || node.parent.parent != null)
            throw new TreeException(TreeError.INVALID_NODE,
                    "Attempting to regraft a node without detached parent");

        RootedNode fragment = node.parent;
        NodeLink freeLink;
        if (fragment.left == node && fragment.right == null)
            freeLink = NodeLink.rightOf(fragment);
        else if (fragment.right == node && fragment.left == null)
            freeLink = NodeLink.leftOf(fragment);
        else
            throw new TreeException(TreeError.INVALID_NODE,
                    "Parent of " + node + " has no free child slot");

        if (fragment.isAncestorOf(target))
            throw new TreeException(TreeError.INVALID_NODE,
                    "Attempting to regraft " + node + " onto its own subtree at " + target);

        NodeLink edgeFromParent = getSister(target).getSelf();

        // set new parents
        fragment.parent = target.parent;
        target.parent = fragment;
        // set new children
        if (edgeFromParent.isPresent())
            edgeFromParent.set(fragment);
        freeLink.set(target);

        if (LOG.isLoggable(Level.FINE))
            LOG.fine("Regrafted " + node + " onto the edge above " + target);
    }

    /**
     * Checks that every child below {@code root} points back to its parent, that no node has a
     * single child and that {@code root} itself has no parent.
     * @throws TreeException with {@link TreeError#INVALID_TREE} naming the first broken node
     */
    public static void checkTree(RootedNode root) {
        if (root.parent != null)
            throw new TreeException(TreeError.INVALID_TREE, "Node " + root + " is not a root");
        checkSubtree(root);
    }

    private static void checkSubtree(RootedNode node) {
        if (node.left == null && node.right == null)
            return;
        if (node.left == null || node.right == null)
            throw new TreeException(TreeError.INVALID_TREE, "Node " + node + " has a single child");
        if (node.left.parent != node || node.right.parent != node)
            throw new TreeException(TreeError.INVALID_TREE, "Children of " + node + " do not point back to it");
        checkSubtree(node.left);
        checkSubtree(node.right);
    }
}
