package com.yongkangl.parsimony.fitch;

import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.CharacterState;
import com.yongkangl.parsimony.model.Operation;
import org.apache.commons.math3.util.Pair;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.List;

import static com.yongkangl.parsimony.TreeFixtures.find;
import static com.yongkangl.parsimony.TreeFixtures.tree;

public final class TopDownPassUnitTest {

    private static List<Pair<TreeNode, Integer>> bothPasses(TreeNode root) {
        BottomUpPass.run(root);
        return TopDownPass.run(root);
    }

    @Test
    public void testAmbiguousRoot() {
        TreeNode root = tree("((A,B)ab,C)root;", 1, 1, 0);
        List<Pair<TreeNode, Integer>> ambiguous = bothPasses(root);

        Assert.assertEquals(ambiguous.size(), 2);
        Assert.assertSame(ambiguous.get(0).getFirst(), root);
        Assert.assertEquals(ambiguous.get(0).getSecond(), Integer.valueOf(0));
        Assert.assertSame(ambiguous.get(1).getFirst(), root);
        Assert.assertEquals(ambiguous.get(1).getSecond(), Integer.valueOf(1));
        Assert.assertEquals(find(root, "ab").getState(), CharacterState.ONE);
    }

    @Test
    public void testAdoptsResolvedAncestor() {
        TreeNode root = tree("((A,B)ab,(C,D)cd)root;", 1, 1, 1, 0);
        List<Pair<TreeNode, Integer>> ambiguous = bothPasses(root);

        Assert.assertTrue(ambiguous.isEmpty());
        Assert.assertEquals(root.getState(), CharacterState.ONE);
        Assert.assertEquals(find(root, "cd").getState(), CharacterState.ONE);
    }

    @Test
    public void testAmbiguityPropagatesDown() {
        TreeNode root = tree("((A,B)ab,(C,D)cd)root;", 1, 0, 1, 0);
        List<Pair<TreeNode, Integer>> ambiguous = bothPasses(root);

        Assert.assertEquals(ambiguous.size(), 6);
        Assert.assertSame(ambiguous.get(0).getFirst(), root);
        Assert.assertSame(ambiguous.get(2).getFirst(), find(root, "ab"));
        Assert.assertSame(ambiguous.get(4).getFirst(), find(root, "cd"));
        Assert.assertEquals(AmbiguityResolver.countDistinctNodes(ambiguous), 3);
    }

    @Test
    public void testRecoversAncestorValueReachableFromBelow() {
        TreeNode root = tree("(((A,B)x,C)y,D)z;", 0, 1, 1, 0);
        bothPasses(root);
        // y was {1} after the first pass; the parent's {0,1} is reachable through x
        Assert.assertEquals(find(root, "y").getState(), CharacterState.BOTH);
        Assert.assertEquals(find(root, "x").getState(), CharacterState.BOTH);
    }

    @Test
    public void testRefineRules() {
        TreeNode node = tree("(A,B)n;", 0, 0);
        node.setState(CharacterState.ZERO);
        node.setOperation(Operation.INTERSECT);
        // ancestor value unreachable from below
        Assert.assertEquals(TopDownPass.refine(node, CharacterState.ONE), CharacterState.ZERO);
        // ancestor already inside the node's set
        Assert.assertEquals(TopDownPass.refine(node, CharacterState.ZERO), CharacterState.ZERO);

        node.getChild(1).setState(CharacterState.BOTH);
        Assert.assertEquals(TopDownPass.refine(node, CharacterState.ONE), CharacterState.BOTH);

        node.setOperation(Operation.UNION);
        node.getChild(1).setState(CharacterState.ZERO);
        Assert.assertEquals(TopDownPass.refine(node, CharacterState.ONE), CharacterState.BOTH);
    }

    @Test
    public void testLeavesAreNeverReported() {
        TreeNode root = tree("(A,B);", 1, 0);
        List<Pair<TreeNode, Integer>> ambiguous = bothPasses(root);
        Assert.assertEquals(AmbiguityResolver.countDistinctNodes(ambiguous), 1);
        Assert.assertEquals(root.getChild(0).getState(), CharacterState.ONE);
        Assert.assertEquals(root.getChild(1).getState(), CharacterState.ZERO);
    }
}
