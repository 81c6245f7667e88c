package com.yongkangl.parsimony.fitch;

import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.CharacterState;
import com.yongkangl.parsimony.model.Operation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * First Fitch pass. Visits nodes children-first and gives each internal node the intersection of its
 * children's states, or their union when the intersection is empty. Each union costs one change.
 */
public final class BottomUpPass {
    private static final Logger logger = LogManager.getLogger(BottomUpPass.class);

    private BottomUpPass() {
    }

    /**
     * Mutates states, operations and change flags in place. Leaves keep their states.
     *
     * @return the minimum number of changes
     */
    public static int run(TreeNode root) {
        int minChanges = 0;
        for (TreeNode node : root.postorder()) {
            node.setGain(false);
            node.setLoss(false);

            if (node.isLeaf()) {
                continue;
            }

            CharacterState shared = node.getChild(0).getState();
            CharacterState union = shared;
            for (int i = 1; i < node.getChildCount(); i++) {
                CharacterState childState = node.getChild(i).getState();
                shared = shared == null ? null : shared.intersect(childState);
                union = union.union(childState);
            }

            if (shared != null) {
                node.setState(shared);
                node.setOperation(Operation.INTERSECT);
            } else {
                node.setState(union);
                node.setOperation(Operation.UNION);
                minChanges++;
            }
        }
        logger.debug("Bottom-up pass: {} minimum changes", minChanges);
        return minChanges;
    }
}
