package com.yongkangl.parsimony;

import com.yongkangl.parsimony.io.NewickParser;
import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.CharacterState;
import org.apache.commons.math3.random.RandomDataGenerator;

import java.util.ArrayList;
import java.util.List;

public final class TreeFixtures {
    private TreeFixtures() {
    }

    /**
     * Parses {@code newick} and gives its leaves, in left-to-right order, the given states.
     */
    public static TreeNode tree(String newick, int... states) {
        TreeNode root = new NewickParser(newick).parse();
        List<TreeNode> leaves = root.getLeaves();
        if (leaves.size() != states.length) {
            throw new IllegalArgumentException("Tree has " + leaves.size() + " leaves but " + states.length + " states were given");
        }
        for (int i = 0; i < states.length; i++) {
            leaves.get(i).setState(CharacterState.of(states[i]));
        }
        return root;
    }

    public static TreeNode find(TreeNode root, String name) {
        for (TreeNode node : root.preorder()) {
            if (name.equals(node.getName())) {
                return node;
            }
        }
        throw new IllegalArgumentException("No node named " + name);
    }

    /**
     * Random rooted tree on {@code leafCount} leaves t1..tN with random states and internal nodes n1, n2, ...
     * About a third of the internal nodes get three children, the rest two.
     */
    public static TreeNode randomTree(RandomDataGenerator random, int leafCount) {
        List<TreeNode> pool = new ArrayList<>();
        for (int i = 1; i <= leafCount; i++) {
            pool.add(new TreeNode(null, "t" + i, CharacterState.of(random.nextInt(0, 1))));
        }
        int internal = 0;
        while (pool.size() > 1) {
            int arity = pool.size() >= 3 && random.getRandomGenerator().nextInt(3) == 0 ? 3 : 2;
            TreeNode parent = new TreeNode(null);
            parent.setName("n" + (++internal));
            for (int i = 0; i < arity; i++) {
                parent.addChild(pool.remove(random.getRandomGenerator().nextInt(pool.size())));
            }
            pool.add(parent);
        }
        return pool.get(0);
    }
}
