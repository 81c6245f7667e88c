package com.yongkangl.parsimony.model;

import com.yongkangl.parsimony.io.AnnotatedTreeWriter;
import com.yongkangl.parsimony.io.TreeNode;

import java.util.List;

/**
 * One most-parsimonious history: a private copy of the tree with every node resolved to a single state
 * and gain/loss flags on the nodes whose incoming edge changes state.
 * Two histories are equal when names, states, flags, branch lengths and child order all match.
 */
public final class AnnotatedTree {
    private final TreeNode root;
    private final String signature;

    public AnnotatedTree(TreeNode root) {
        this.root = root.deepCopy();
        this.signature = AnnotatedTreeWriter.toNewick(this.root);
    }

    /**
     * @return a fresh copy, so callers cannot alter this history
     */
    public TreeNode getRoot() {
        return root.deepCopy();
    }

    public List<String> getGains() {
        return AnnotatedTreeWriter.gains(root);
    }

    public List<String> getLosses() {
        return AnnotatedTreeWriter.losses(root);
    }

    /**
     * Gains plus losses, the spontaneous gain at the root included.
     */
    public int getChangeCount() {
        int count = 0;
        for (TreeNode node : root.preorder()) {
            if (node.isGain()) count++;
            if (node.isLoss()) count++;
        }
        return count;
    }

    public String toNewick() {
        return signature;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnnotatedTree)) return false;
        return signature.equals(((AnnotatedTree) o).signature);
    }

    @Override
    public int hashCode() {
        return signature.hashCode();
    }

    @Override
    public String toString() {
        return signature;
    }
}
