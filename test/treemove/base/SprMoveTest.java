package treemove.base;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SprMoveTest {

    private RootedNode a, b, c, d, r;
    private RootedTree tree;
    private SprMove move;

    // (A,(C,D)B)R
    @BeforeEach
    void buildTree() {
        a = new RootedNode("A");
        c = new RootedNode("C");
        d = new RootedNode("D");
        b = new RootedNode("B", c, d);
        r = new RootedNode("R", a, b);
        tree = new RootedTree(r);
        move = new SprMove(new MoveSettings(true, 1, 3));
    }

    @Test
    void moveOntoCousin() {
        RollbackRecord rollback = move.apply(c, a, tree, true);

        assertEquals("((C,A)B,D)R", tree.print());
        assertSame(r, tree.getRoot());
        assertSame(b, r.left);
        assertSame(d, r.right);
        assertSame(b, a.parent);
        assertSame(b, c.parent);
        for (RootedNode leaf : new RootedNode[] {a, c, d})
            assertSame(tree.getRoot(), leaf.findRoot());
        TreeOperations.checkTree(tree.getRoot());

        assertEquals(RearrangeType.SPR, rollback.getType());
        assertTrue(rollback.isRooted());
        assertSame(c, rollback.getPruneEdge());
        assertSame(d, rollback.getRegraftEdge());
    }

    @Test
    void rollbackRestoresEveryLink() {
        RollbackRecord rollback = move.apply(c, a, tree, true);
        move.rollback(rollback, tree);

        assertEquals("(A,(C,D)B)R", tree.print());
        assertSame(r, tree.getRoot());
        assertNull(r.parent);
        assertSame(a, r.left);
        assertSame(b, r.right);
        assertSame(c, b.left);
        assertSame(d, b.right);
        assertSame(r, a.parent);
        assertSame(r, b.parent);
        assertSame(b, c.parent);
        assertSame(b, d.parent);
    }

    @Test
    void moveChangesRoot() {
        RollbackRecord rollback = move.apply(a, c, tree, true);

        assertSame(b, tree.getRoot());
        assertEquals("((A,C)R,D)B", tree.print());
        TreeOperations.checkTree(tree.getRoot());

        move.rollback(rollback, tree);
        assertSame(r, tree.getRoot());
        assertEquals("(A,(C,D)B)R", tree.print());
    }

    @Test
    void moveAboveRoot() {
        move.apply(c, r, tree, false);

        assertSame(b, tree.getRoot());
        assertEquals("(C,(A,D)R)B", tree.print());
    }

    @Test
    void noRollbackRequested() {
        assertNull(move.apply(c, a, tree, false));
    }

    @Test
    void moveWithoutRootHolder() {
        move.apply(a, c, null, false);

        assertSame(b, a.findRoot());
        TreeOperations.checkTree(b);
    }

    @Test
    void branchLengthsAreNotRecorded() {
        RollbackRecord rollback = move.apply(c, a, tree, true);

        assertFalse(rollback.hasBranchLengths());
        assertFalse(rollback.getPruneLength().isPresent());
        assertFalse(rollback.getPruneLeftLength().isPresent());
        assertFalse(rollback.getPruneRightLength().isPresent());
        assertFalse(rollback.getRegraftLength().isPresent());
    }

    @Test
    void invalidMovesLeaveTreeUntouched() {
        TreeException root = assertThrows(TreeException.class, () -> move.apply(r, a, tree, true));
        assertEquals(TreeError.INVALID_NODE, root.getError());

        TreeException parent = assertThrows(TreeException.class, () -> move.apply(c, b, tree, true));
        assertEquals(TreeError.INVALID_NODE, parent.getError());

        TreeException inside = assertThrows(TreeException.class, () -> move.apply(b, c, tree, true));
        assertEquals(TreeError.INVALID_NODE, inside.getError());

        TreeException self = assertThrows(TreeException.class, () -> move.apply(b, b, tree, true));
        assertEquals(TreeError.INVALID_NODE, self.getError());

        assertEquals("(A,(C,D)B)R", tree.print());
        TreeOperations.checkTree(r);
    }

    @Test
    void failedRegraftIsRestored() {
        RootedNode stray = new RootedNode("X");
        stray.parent = a;

        PartialMoveException e = assertThrows(PartialMoveException.class, () -> move.apply(c, stray, tree, true));

        assertTrue(e.isTreeRestored());
        assertEquals(TreeError.INVALID_TREE, e.getError());
        assertSame(c, e.getPrunedNode());
        assertSame(b, e.getFragment());
        assertSame(r, e.getConnectedNode());
        assertEquals("(A,(C,D)B)R", tree.print());
        TreeOperations.checkTree(r);
    }

    @Test
    void failedRegraftLeftPruned() {
        SprMove lenient = new SprMove(new MoveSettings(false, 1, 3));
        RootedNode stray = new RootedNode("X");
        stray.parent = a;

        PartialMoveException e = assertThrows(PartialMoveException.class, () -> lenient.apply(c, stray, tree, true));

        assertFalse(e.isTreeRestored());
        assertSame(b, e.getFragment());
        assertNull(b.parent);
        assertSame(c, b.left);
        assertEquals("(A,D)R", r.print());

        // the caller can put the fragment back by hand
        TreeOperations.regraft(c, d);
        assertEquals("(A,(C,D)B)R", r.print());
    }

    @Test
    void unrootedRecordIsRejected() {
        RollbackRecord unrooted = new RollbackRecord(RearrangeType.SPR, false, c, d);

        TreeException e = assertThrows(TreeException.class, () -> move.rollback(unrooted, tree));
        assertEquals(TreeError.INVALID_NODE, e.getError());
    }

    @Test
    void randomMovesAreAlwaysUndone() {
        RootedNode root = TestTrees.balanced(4);
        RootedTree randomTree = new RootedTree(root);
        String original = randomTree.print();
        List<RootedNode> nodes = TestTrees.preorder(root);
        Random random = new Random(42);

        int applied = 0;
        for (int i = 0; i < 300; i++) {
            RootedNode source = nodes.get(random.nextInt(nodes.size()));
            if (source.parent == null)
                continue;
            List<RootedNode> targets = new ArrayList<RootedNode>();
            for (RootedNode node : nodes) {
                if (node != source.parent && !source.isAncestorOf(node))
                    targets.add(node);
            }
            RootedNode target = targets.get(random.nextInt(targets.size()));

            RollbackRecord rollback = move.apply(source, target, randomTree, true);
            TreeOperations.checkTree(randomTree.getRoot());
            assertEquals(nodes.size(), randomTree.size());
            assertSame(source.parent, target.parent);

            move.rollback(rollback, randomTree);
            assertEquals(original, randomTree.print());
            applied++;
        }
        assertTrue(applied > 0);
    }
}
