package com.yongkangl.parsimony.io;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Text rendering of annotated trees for downstream reports.
 */
public final class AnnotatedTreeWriter {
    private AnnotatedTreeWriter() {
    }

    /**
     * Newick with one NHX comment per node, e.g. {@code ((A[&&NHX:state=1],B[&&NHX:state=0:loss=1]):1.0[&&NHX:state=1:gain=1])[&&NHX:state=0];}.
     * Unresolved nodes print their candidate set, e.g. {@code state=0|1}.
     */
    public static String toNewick(TreeNode root) {
        StringBuilder sb = new StringBuilder();
        appendNode(sb, root);
        sb.append(";");
        return sb.toString();
    }

    private static void appendNode(StringBuilder sb, TreeNode node) {
        if (!node.isLeaf()) {
            sb.append("(");
            for (int i = 0; i < node.getChildCount(); i++) {
                if (i > 0) sb.append(",");
                appendNode(sb, node.getChild(i));
            }
            sb.append(")");
        }
        sb.append(quote(node.getName()));
        if (!node.isRoot()) {
            sb.append(":").append(node.getBranchLength());
        }
        sb.append("[&&NHX");
        if (node.getState() != null) {
            sb.append(":state=").append(node.getState().isAmbiguous() ? "0|1" : String.valueOf(node.getState().value()));
        }
        if (node.isGain()) {
            sb.append(":gain=1");
        }
        if (node.isLoss()) {
            sb.append(":loss=1");
        }
        sb.append("]");
    }

    private static String quote(String name) {
        if (StringUtils.containsAny(name, ",():;[]' ")) {
            return "'" + name.replace("'", "''") + "'";
        }
        return StringUtils.defaultString(name);
    }

    public static List<String> gains(TreeNode root) {
        List<String> names = new ArrayList<>();
        for (TreeNode node : root.preorder()) {
            if (node.isGain()) {
                names.add(node.getName());
            }
        }
        return names;
    }

    public static List<String> losses(TreeNode root) {
        List<String> names = new ArrayList<>();
        for (TreeNode node : root.preorder()) {
            if (node.isLoss()) {
                names.add(node.getName());
            }
        }
        return names;
    }

    /**
     * One line per node: depth-indented name, state and any change event.
     */
    public static String toTable(TreeNode root) {
        StringBuilder sb = new StringBuilder();
        for (TreeNode node : root.preorder()) {
            sb.append(StringUtils.repeat("  ", node.getAncestors().size()));
            sb.append(StringUtils.isEmpty(node.getName()) ? "*" : node.getName());
            sb.append("\t").append(node.getState());
            if (node.isGain()) {
                sb.append("\tgain");
            }
            if (node.isLoss()) {
                sb.append("\tloss");
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
