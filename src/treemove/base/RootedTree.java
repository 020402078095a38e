package treemove.base;

/**
 * Holds the root of a tree whose topology is being changed.
 * The holder does not own the nodes, it only keeps track of which node is the root.
 */
public class RootedTree {

    private RootedNode root;

    public RootedTree(RootedNode root) {
        if (root == null)
            throw new IllegalArgumentException("root must not be null");
        this.root = root;
    }

    public RootedNode getRoot() {
        return root;
    }

    /**
     * Moves the root handle upward until it has no parent. Needed after any move that may
     * have inserted a node above the old root.
     * @return the new root
     */
    public RootedNode resetRoot() {
        while (root.parent != null)
            root = root.parent;
        return root;
    }

    /**
     * @return the number of nodes of the tree
     */
    public int size() {
        return root.countNodes();
    }

    public String print() {
        return root.print();
    }

    @Override
    public String toString() {
        return print();
    }
}
