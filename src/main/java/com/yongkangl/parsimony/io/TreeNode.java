package com.yongkangl.parsimony.io;

import com.yongkangl.parsimony.model.CharacterState;
import com.yongkangl.parsimony.model.Operation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.IdentityHashMap;

public class TreeNode {
    public static final double DEFAULT_BRANCH_LENGTH = 1.0;

    private String name;
    private double branchLength;
    // Not owned; children are owned through the list below.
    private TreeNode parent;
    private final List<TreeNode> children;
    private CharacterState state;
    private Operation operation;
    private boolean gain;
    private boolean loss;

    public TreeNode(TreeNode parent) {
        this.parent = parent;
        this.children = new ArrayList<>();
        this.name = "";
        this.branchLength = parent == null ? 0.0 : DEFAULT_BRANCH_LENGTH;
    }

    public TreeNode(TreeNode parent, String name, CharacterState state) {
        this(parent);
        this.name = name;
        this.state = state;
    }

    public void addChild(TreeNode child) {
        child.parent = this;
        children.add(child);
    }

    public void removeChild(int i) {
        children.remove(i).parent = null;
    }

    /**
     * Copies this node and everything below it. The copy has no parent and shares no node with this tree.
     */
    public TreeNode deepCopy() {
        TreeNode copy = new TreeNode(null);
        copyAnnotations(this, copy);
        Deque<TreeNode[]> pending = new ArrayDeque<>();
        pending.push(new TreeNode[]{this, copy});
        while (!pending.isEmpty()) {
            TreeNode[] pair = pending.pop();
            for (TreeNode child : pair[0].children) {
                TreeNode childCopy = new TreeNode(pair[1]);
                copyAnnotations(child, childCopy);
                pair[1].addChild(childCopy);
                pending.push(new TreeNode[]{child, childCopy});
            }
        }
        return copy;
    }

    private static void copyAnnotations(TreeNode from, TreeNode to) {
        to.name = from.name;
        to.branchLength = from.branchLength;
        to.state = from.state;
        to.operation = from.operation;
        to.gain = from.gain;
        to.loss = from.loss;
    }

    /**
     * Parents before children, children in their stored order.
     */
    public List<TreeNode> preorder() {
        List<TreeNode> nodes = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            nodes.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return nodes;
    }

    /**
     * Children before parents, children in their stored order.
     */
    public List<TreeNode> postorder() {
        List<TreeNode> nodes = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            nodes.add(node);
            for (TreeNode child : node.children) {
                stack.push(child);
            }
        }
        Collections.reverse(nodes);
        return nodes;
    }

    public List<TreeNode> getLeaves() {
        List<TreeNode> leaves = new ArrayList<>();
        for (TreeNode node : preorder()) {
            if (node.isLeaf()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    public List<String> getLeafNames() {
        List<String> names = new ArrayList<>();
        for (TreeNode leaf : getLeaves()) {
            names.add(leaf.name);
        }
        return names;
    }

    /**
     * @return the parent, grandparent and so on up to the root
     */
    public List<TreeNode> getAncestors() {
        List<TreeNode> ancestors = new ArrayList<>();
        for (TreeNode node = parent; node != null; node = node.parent) {
            ancestors.add(node);
        }
        return ancestors;
    }

    /**
     * Lowest node that has every target node in its subtree (a node counts as in its own subtree).
     */
    public TreeNode getCommonAncestor(List<TreeNode> targets) {
        if (targets.isEmpty()) {
            return this;
        }
        List<TreeNode> path = targets.get(0).getAncestors();
        path.add(0, targets.get(0));
        Collections.reverse(path);

        int shared = path.size();
        for (TreeNode target : targets.subList(1, targets.size())) {
            Set<TreeNode> lineage = Collections.newSetFromMap(new IdentityHashMap<>());
            lineage.add(target);
            lineage.addAll(target.getAncestors());
            int depth = 0;
            while (depth < shared && lineage.contains(path.get(depth))) {
                depth++;
            }
            shared = depth;
        }
        if (shared == 0) {
            throw new IllegalArgumentException("Nodes do not share a common ancestor");
        }
        return path.get(shared - 1);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getBranchLength() {
        return branchLength;
    }

    public void setBranchLength(double branchLength) {
        this.branchLength = branchLength;
    }

    public TreeNode getParent() {
        return parent;
    }

    public int getChildCount() {
        return children.size();
    }

    public TreeNode getChild(int i) {
        return children.get(i);
    }

    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parent == null;
    }

    public CharacterState getState() {
        return state;
    }

    public void setState(CharacterState state) {
        this.state = state;
    }

    public Operation getOperation() {
        return operation;
    }

    public void setOperation(Operation operation) {
        this.operation = operation;
    }

    public boolean isGain() {
        return gain;
    }

    public void setGain(boolean gain) {
        this.gain = gain;
    }

    public boolean isLoss() {
        return loss;
    }

    public void setLoss(boolean loss) {
        this.loss = loss;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!children.isEmpty()) {
            sb.append("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(",");
                sb.append(children.get(i).toString());
            }
            sb.append(")");
        }
        sb.append(name);
        if (parent != null) {
            sb.append(":").append(branchLength);
        }
        return sb.toString();
    }
}
