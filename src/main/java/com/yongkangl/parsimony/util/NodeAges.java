package com.yongkangl.parsimony.util;

import com.yongkangl.parsimony.io.TreeNode;
import org.apache.commons.math3.util.Pair;

import java.util.LinkedHashMap;
import java.util.Map;

public final class NodeAges {
    private NodeAges() {
    }

    /**
     * Age of every node, in postorder: 0 for leaves, the branch-length distance to the farthest
     * descendant leaf for internal nodes. Keyed by node identity since internal names may repeat.
     */
    public static Map<TreeNode, Double> of(TreeNode root) {
        Map<TreeNode, Double> ages = new LinkedHashMap<>();
        for (TreeNode node : root.postorder()) {
            double age = 0.0;
            for (TreeNode child : node.getChildren()) {
                age = Math.max(age, ages.get(child) + child.getBranchLength());
            }
            ages.put(node, age);
        }
        return ages;
    }

    /**
     * Farthest leaf below {@code node} and its distance; the first one in child order wins ties.
     */
    public static Pair<TreeNode, Double> farthestLeaf(TreeNode node) {
        if (node.isLeaf()) {
            return new Pair<>(node, 0.0);
        }
        Pair<TreeNode, Double> best = null;
        for (TreeNode child : node.getChildren()) {
            Pair<TreeNode, Double> candidate = farthestLeaf(child);
            double distance = candidate.getSecond() + child.getBranchLength();
            if (best == null || distance > best.getSecond()) {
                best = new Pair<>(candidate.getFirst(), distance);
            }
        }
        return best;
    }

    /**
     * Sum of branch lengths from the root down to {@code node}.
     */
    public static double depth(TreeNode node) {
        double depth = 0.0;
        for (TreeNode current = node; !current.isRoot(); current = current.getParent()) {
            depth += current.getBranchLength();
        }
        return depth;
    }
}
