package com.yongkangl.parsimony.io;

import com.yongkangl.parsimony.model.CharacterState;
import com.yongkangl.parsimony.model.Operation;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.yongkangl.parsimony.TreeFixtures.find;
import static com.yongkangl.parsimony.TreeFixtures.tree;

public final class TreeNodeUnitTest {

    private static List<String> names(List<TreeNode> nodes) {
        List<String> names = new ArrayList<>();
        for (TreeNode node : nodes) {
            names.add(node.getName());
        }
        return names;
    }

    @Test
    public void testTraversals() {
        TreeNode root = tree("((A,B)ab,(C,D,E)cde)root;", 0, 0, 1, 1, 0);
        Assert.assertEquals(names(root.preorder()), Arrays.asList("root", "ab", "A", "B", "cde", "C", "D", "E"));
        Assert.assertEquals(names(root.postorder()), Arrays.asList("A", "B", "ab", "C", "D", "E", "cde", "root"));
        Assert.assertEquals(root.getLeafNames(), Arrays.asList("A", "B", "C", "D", "E"));
    }

    @Test
    public void testParentLinks() {
        TreeNode root = tree("((A,B)ab,C)root;", 0, 0, 1);
        TreeNode a = find(root, "A");
        Assert.assertSame(a.getParent(), find(root, "ab"));
        Assert.assertEquals(names(a.getAncestors()), Arrays.asList("ab", "root"));
        Assert.assertTrue(root.isRoot());
        Assert.assertFalse(a.isRoot());
        Assert.assertTrue(a.isLeaf());
    }

    @Test
    public void testCommonAncestor() {
        TreeNode root = tree("((A,B)ab,(C,D)cd)root;", 0, 0, 1, 1);
        TreeNode a = find(root, "A");
        TreeNode b = find(root, "B");
        TreeNode c = find(root, "C");
        Assert.assertSame(root.getCommonAncestor(Arrays.asList(a, b)), find(root, "ab"));
        Assert.assertSame(root.getCommonAncestor(Arrays.asList(a, c)), root);
        Assert.assertSame(root.getCommonAncestor(Arrays.asList(a, find(root, "ab"))), find(root, "ab"));
        Assert.assertSame(root.getCommonAncestor(root.getLeaves()), root);
    }

    @Test
    public void testCommonAncestorBelowSingleChildRoot() {
        TreeNode root = tree("(((A,B)ab,C)abc)root;", 0, 0, 1);
        Assert.assertSame(root.getCommonAncestor(root.getLeaves()), find(root, "abc"));
    }

    @Test
    public void testDeepCopyIsIndependent() {
        TreeNode root = tree("((A:2,B)ab,C)root;", 0, 1, 1);
        find(root, "ab").setState(CharacterState.BOTH);
        find(root, "ab").setOperation(Operation.UNION);
        find(root, "B").setGain(true);

        TreeNode copy = root.deepCopy();
        Assert.assertEquals(copy.toString(), root.toString());
        Assert.assertNull(copy.getParent());
        Assert.assertEquals(find(copy, "ab").getState(), CharacterState.BOTH);
        Assert.assertEquals(find(copy, "ab").getOperation(), Operation.UNION);
        Assert.assertTrue(find(copy, "B").isGain());
        Assert.assertEquals(find(copy, "A").getBranchLength(), 2.0, 1e-12);

        List<TreeNode> originals = root.preorder();
        List<TreeNode> copies = copy.preorder();
        for (int i = 0; i < originals.size(); i++) {
            Assert.assertNotSame(copies.get(i), originals.get(i));
        }
        for (TreeNode node : copies) {
            for (TreeNode child : node.getChildren()) {
                Assert.assertSame(child.getParent(), node);
            }
        }

        find(copy, "A").setState(CharacterState.ONE);
        find(copy, "ab").setLoss(true);
        Assert.assertEquals(find(root, "A").getState(), CharacterState.ZERO);
        Assert.assertFalse(find(root, "ab").isLoss());
    }

    @Test
    public void testRemoveChildDetaches() {
        TreeNode root = tree("((A,B)ab,C)root;", 0, 1, 1);
        TreeNode c = find(root, "C");
        root.removeChild(1);
        Assert.assertNull(c.getParent());
        Assert.assertEquals(root.getChildCount(), 1);
    }

    @Test
    public void testToString() {
        TreeNode root = tree("((A:0.5,B)ab,C);", 0, 1, 1);
        Assert.assertEquals(root.toString(), "((A:0.5,B:1.0)ab:1.0,C:1.0)");
    }
}
