package com.yongkangl.parsimony.fitch;

import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.AnnotatedTree;
import com.yongkangl.parsimony.model.CharacterState;
import com.yongkangl.parsimony.model.ParsimonyConfig;
import com.yongkangl.parsimony.model.Reconstruction;
import com.yongkangl.parsimony.model.Reconstruction.Outcome;
import com.yongkangl.parsimony.util.InvalidInputException;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Minimum-change reconstruction of a binary character on a rooted tree: bottom-up pass, top-down pass,
 * enumeration of equally parsimonious histories, then the origin veto.
 * <p>
 * The input tree is never modified; all work happens on a private copy, so one instance may serve
 * concurrent callers.
 */
public class FitchParsimony {
    private static final Logger logger = LogManager.getLogger(FitchParsimony.class);

    private final ParsimonyConfig config;
    private final AmbiguityResolver resolver;

    public FitchParsimony() {
        this(ParsimonyConfig.defaults());
    }

    public FitchParsimony(ParsimonyConfig config) {
        this.config = config;
        this.resolver = new AmbiguityResolver(config);
    }

    public Reconstruction reconstruct(TreeNode root) {
        return reconstruct(null, root);
    }

    /**
     * @param trait label carried into the result, may be null
     * @param root  root of a tree whose leaves all hold state {0} or {1}
     * @throws InvalidInputException if the tree is missing, not rooted at {@code root}, inconsistently linked,
     *                               or has a leaf without a single state
     */
    public Reconstruction reconstruct(String trait, TreeNode root) {
        validate(root);
        TreeNode working = root.deepCopy();

        int minChanges = BottomUpPass.run(working);
        List<Pair<TreeNode, Integer>> ambiguousNodes = TopDownPass.run(working);
        int r = AmbiguityResolver.countDistinctNodes(ambiguousNodes);
        List<AnnotatedTree> histories = resolver.resolve(working, ambiguousNodes, minChanges);

        Outcome outcome;
        if (r > config.getMaxAmbiguousNodes()) {
            outcome = Outcome.TOO_AMBIGUOUS;
        } else if (histories.isEmpty()) {
            outcome = Outcome.NO_OPTIMAL_ASSIGNMENT;
        } else {
            outcome = Outcome.RESOLVED;
        }

        if (config.isApplyOriginVeto() && OriginVeto.vetoes(working)) {
            if (outcome != Outcome.TOO_AMBIGUOUS) {
                outcome = Outcome.ORIGIN_VETOED;
            }
            histories = Collections.emptyList();
        }

        Reconstruction reconstruction = new Reconstruction(trait, minChanges, r, outcome, histories);
        logger.debug("Reconstructed {}", reconstruction);
        return reconstruction;
    }

    static void validate(TreeNode root) {
        if (root == null) {
            throw new InvalidInputException("Empty tree");
        }
        if (!root.isRoot()) {
            throw new InvalidInputException("Node '" + root.getName() + "' has a parent and is not a tree root");
        }
        Set<TreeNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<TreeNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TreeNode node = pending.pop();
            if (!seen.add(node)) {
                throw new InvalidInputException("Node '" + node.getName() + "' is reachable twice; input is not a tree");
            }
            if (node.isLeaf()) {
                CharacterState state = node.getState();
                if (state == null || state.isAmbiguous()) {
                    throw new InvalidInputException("Leaf '" + node.getName() + "' has no single state, got " + state);
                }
            }
            for (TreeNode child : node.getChildren()) {
                if (child.getParent() != node) {
                    throw new InvalidInputException("Node '" + child.getName() + "' is not linked back to its parent '" + node.getName() + "'");
                }
                pending.push(child);
            }
        }
    }
}
