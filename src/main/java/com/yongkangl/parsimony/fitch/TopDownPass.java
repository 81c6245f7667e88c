package com.yongkangl.parsimony.fitch;

import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.CharacterState;
import com.yongkangl.parsimony.model.Operation;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Second Fitch pass. Visits internal nodes parent-first and refines each state against its parent's.
 * Must run on a tree already processed by {@link BottomUpPass}.
 */
public final class TopDownPass {
    private static final Logger logger = LogManager.getLogger(TopDownPass.class);

    private TopDownPass() {
    }

    /**
     * Refines states in place.
     *
     * @return (node, candidate value) for every node still holding {0,1}, two entries per node in preorder
     */
    public static List<Pair<TreeNode, Integer>> run(TreeNode root) {
        List<Pair<TreeNode, Integer>> ambiguousNodes = new ArrayList<>();

        for (TreeNode node : root.preorder()) {
            if (node.isLeaf()) {
                continue;
            }

            if (node != root) {
                node.setState(refine(node, node.getParent().getState()));
            }

            if (node.getState().isAmbiguous()) {
                ambiguousNodes.add(new Pair<>(node, 0));
                ambiguousNodes.add(new Pair<>(node, 1));
            }
        }
        logger.debug("Top-down pass: {} ambiguous nodes", ambiguousNodes.size() / 2);
        return ambiguousNodes;
    }

    static CharacterState refine(TreeNode node, CharacterState ancestor) {
        CharacterState state = node.getState();
        if (ancestor.isSubsetOf(state)) {
            return state.intersect(ancestor);
        }
        if (node.getOperation() == Operation.UNION) {
            return ancestor.union(state);
        }
        CharacterState fromBelow = node.getChild(0).getState();
        for (TreeNode child : node.getChildren()) {
            fromBelow = fromBelow.union(child.getState());
        }
        CharacterState reachable = ancestor.intersect(fromBelow);
        return reachable == null ? state : state.union(reachable);
    }
}
