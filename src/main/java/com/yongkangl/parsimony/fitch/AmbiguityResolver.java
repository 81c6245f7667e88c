package com.yongkangl.parsimony.fitch;

import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.AnnotatedTree;
import com.yongkangl.parsimony.model.CharacterState;
import com.yongkangl.parsimony.model.ParsimonyConfig;
import org.apache.commons.math3.util.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the state sets left by the two Fitch passes into concrete histories.
 * <p>
 * With no ambiguous node the refined states already form a single history. Otherwise every assignment of
 * 0/1 to the ambiguous nodes is scored by counting changed edges, plus one gain when the root is assigned 1,
 * and assignments whose score equals the minimum from the bottom-up pass are kept.
 */
public class AmbiguityResolver {
    private static final Logger logger = LogManager.getLogger(AmbiguityResolver.class);

    private final ParsimonyConfig config;

    public AmbiguityResolver(ParsimonyConfig config) {
        this.config = config;
    }

    /**
     * Number of distinct nodes among the (node, value) records of {@link TopDownPass#run}.
     */
    public static int countDistinctNodes(List<Pair<TreeNode, Integer>> ambiguousNodes) {
        return distinctNodes(ambiguousNodes).size();
    }

    private static List<TreeNode> distinctNodes(List<Pair<TreeNode, Integer>> ambiguousNodes) {
        Set<TreeNode> nodes = Collections.newSetFromMap(new IdentityHashMap<>());
        List<TreeNode> ordered = new ArrayList<>();
        for (Pair<TreeNode, Integer> record : ambiguousNodes) {
            if (nodes.add(record.getFirst())) {
                ordered.add(record.getFirst());
            }
        }
        return ordered;
    }

    /**
     * Reads {@code root} without modifying it.
     *
     * @param root           working tree after both passes
     * @param ambiguousNodes records returned by the top-down pass over {@code root}
     * @param minChanges     value returned by the bottom-up pass over {@code root}
     * @return every history scoring {@code minChanges}; empty when there are more ambiguous nodes than
     * {@link ParsimonyConfig#getMaxAmbiguousNodes()}
     */
    public List<AnnotatedTree> resolve(TreeNode root, List<Pair<TreeNode, Integer>> ambiguousNodes, int minChanges) {
        List<TreeNode> ambiguous = distinctNodes(ambiguousNodes);
        int r = ambiguous.size();

        if (r == 0) {
            return annotateResolved(root, minChanges);
        }
        if (r > config.getMaxAmbiguousNodes()) {
            logger.warn("{} ambiguous nodes exceed the limit of {}; skipping enumeration", r, config.getMaxAmbiguousNodes());
            return Collections.emptyList();
        }

        List<TreeNode> nodes = root.preorder();
        Map<TreeNode, Integer> index = new IdentityHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }
        int[] ambiguousIndex = new int[r];
        for (int j = 0; j < r; j++) {
            ambiguousIndex[j] = index.get(ambiguous.get(j));
        }

        int[] fixed = new int[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            CharacterState state = nodes.get(i).getState();
            fixed[i] = state.isAmbiguous() ? -1 : state.value();
        }

        Collection<AnnotatedTree> accepted = config.isDeduplicate() ? new LinkedHashSet<>() : new ArrayList<>();
        int evaluated = 0;
        for (int assignment = 0; assignment < (1 << r); assignment++) {
            int[] effective = fixed.clone();
            for (int j = 0; j < r; j++) {
                effective[ambiguousIndex[j]] = (assignment >> j) & 1;
            }

            boolean[] gain = new boolean[nodes.size()];
            boolean[] loss = new boolean[nodes.size()];
            int totChanges = countChanges(nodes, index, effective, gain, loss);
            evaluated++;

            if (totChanges == minChanges) {
                accepted.add(annotate(root, effective, gain, loss));
            }
        }
        logger.debug("Evaluated {} assignments over {} ambiguous nodes, accepted {}", evaluated, r, accepted.size());
        return new ArrayList<>(accepted);
    }

    private static int countChanges(List<TreeNode> nodes, Map<TreeNode, Integer> index, int[] effective,
                                    boolean[] gain, boolean[] loss) {
        int totChanges = 0;
        // The root has no parent edge, so a present root is charged as a gain of its own.
        if (effective[0] == 1) {
            gain[0] = true;
            totChanges++;
        }
        for (int i = 0; i < nodes.size(); i++) {
            for (TreeNode child : nodes.get(i).getChildren()) {
                int c = index.get(child);
                if (effective[i] == 0 && effective[c] == 1) {
                    gain[c] = true;
                    totChanges++;
                } else if (effective[i] == 1 && effective[c] == 0) {
                    loss[c] = true;
                    totChanges++;
                }
            }
        }
        return totChanges;
    }

    private static AnnotatedTree annotate(TreeNode root, int[] effective, boolean[] gain, boolean[] loss) {
        TreeNode copy = root.deepCopy();
        List<TreeNode> copyNodes = copy.preorder();
        for (int i = 0; i < copyNodes.size(); i++) {
            TreeNode node = copyNodes.get(i);
            node.setState(CharacterState.of(effective[i]));
            node.setGain(gain[i]);
            node.setLoss(loss[i]);
        }
        return new AnnotatedTree(copy);
    }

    private static List<AnnotatedTree> annotateResolved(TreeNode root, int minChanges) {
        TreeNode copy = root.deepCopy();
        int totChanges = 0;
        for (TreeNode node : copy.preorder()) {
            for (TreeNode child : node.getChildren()) {
                if (node.getState() == CharacterState.ZERO && child.getState() == CharacterState.ONE) {
                    child.setGain(true);
                    totChanges++;
                }
                if (node.getState() == CharacterState.ONE && child.getState() == CharacterState.ZERO) {
                    child.setLoss(true);
                    totChanges++;
                }
            }
        }
        // A union over more than two children can leave fixed states that need more than one change.
        if (totChanges != minChanges) {
            logger.debug("Resolved states need {} changes but the minimum is {}; no history kept", totChanges, minChanges);
            return Collections.emptyList();
        }
        return Collections.singletonList(new AnnotatedTree(copy));
    }
}
