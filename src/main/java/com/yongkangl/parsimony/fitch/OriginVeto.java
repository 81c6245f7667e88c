package com.yongkangl.parsimony.fitch;

import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.CharacterState;

/**
 * A trait already present at the common ancestor of all leaves may have arisen anywhere before it,
 * so no history placing its origin inside the tree can be trusted.
 */
public final class OriginVeto {
    private OriginVeto() {
    }

    /**
     * Lowest common ancestor of all leaves. Differs from {@code root} only when the root sits on a
     * single-child basal branch.
     */
    public static TreeNode pseudoRoot(TreeNode root) {
        return root.getCommonAncestor(root.getLeaves());
    }

    /**
     * @param root working tree after both Fitch passes
     */
    public static boolean vetoes(TreeNode root) {
        return pseudoRoot(root).getState() == CharacterState.ONE;
    }
}
