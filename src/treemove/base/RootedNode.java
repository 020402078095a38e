package treemove.base;

/**
 * This is a node of a rooted binary tree.
 * A node is either a leaf (no children) or an internal node with both a left and a right child.
 * The child and parent references are only rewritten by the tree operations of this package,
 * so callers can navigate freely but never observe a node with a single child.
 */
public class RootedNode {

    /** This reference points to the parent of the node, it is null for the root. */
    RootedNode parent;
    /** Left child, null for a leaf. */
    RootedNode left;
    /** Right child, null for a leaf. */
    RootedNode right;

    /**
     * The label of the node. Only used for printing, it may be null for internal nodes.
     */
    private final String name;

    /**
     * Creates a leaf.
     * @param name label of the leaf
     */
    public RootedNode(String name) {
        this.name = name;
    }

    /**
     * Creates an internal node on top of two parentless subtrees.
     * @param name label of the node, may be null
     * @param left left subtree
     * @param right right subtree
     */
    public RootedNode(String name, RootedNode left, RootedNode right) {
        if (left == null || right == null)
            throw new IllegalArgumentException("An internal node needs two children");
        if (left == right)
            throw new IllegalArgumentException("The two children must be distinct nodes");
        if (left.parent != null || right.parent != null)
            throw new IllegalArgumentException("Children must not be attached to another node");
        this.name = name;
        this.left = left;
        this.right = right;
        left.parent = this;
        right.parent = this;
    }

    public String getName() {
        return name;
    }

    public RootedNode getParent() {
        return parent;
    }

    public RootedNode getLeft() {
        return left;
    }

    public RootedNode getRight() {
        return right;
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * @return the other child of the parent, or null for the root
     * @throws TreeException with {@link TreeError#INVALID_TREE} if the parent does not reference this node
     */
    public RootedNode brother() {
        return TreeOperations.getSister(this).getSister().get();
    }

    /**
     * @return the root of the tree this node currently belongs to
     */
    public RootedNode findRoot() {
        RootedNode node = this;
        while (node.parent != null)
            node = node.parent;
        return node;
    }

    /**
     * Tells whether this node lies on the path from {@code node} to the root, {@code node} included.
     */
    public boolean isAncestorOf(RootedNode node) {
        for (RootedNode actual = node; actual != null; actual = actual.parent) {
            if (actual == this)
                return true;
        }
        return false;
    }

    /**
     * This function returns the number of leaves that are below this node.
     * @return the number of leaves that are below this node.
     */
    public int countLeaves() {
        if (left == null || right == null)
            return 1;
        return left.countLeaves() + right.countLeaves();
    }

    /**
     * @return the number of nodes in the subtree of this node, itself included
     */
    public int countNodes() {
        if (left == null || right == null)
            return 1;
        return 1 + left.countNodes() + right.countNodes();
    }

    /**
     * Prints this node and the nodes below in bracket notation, eg. {@code ((A,B)x,C)r}.
     * Unnamed nodes print nothing after their closing bracket.
     */
    public String print() {
        StringBuilder builder = new StringBuilder();
        print(builder);
        return builder.toString();
    }

    private void print(StringBuilder builder) {
        if (left != null && right != null) {
            builder.append('(');
            left.print(builder);
            builder.append(',');
            right.print(builder);
            builder.append(')');
        } else if (left != null || right != null) {
            // half-built node of a detached fragment
            builder.append('(');
            (left != null ? left : right).print(builder);
            builder.append(')');
        }
        if (name != null)
            builder.append(name);
    }

    @Override
    public String toString() {
        return name != null ? name : "<unnamed>";
    }
}
