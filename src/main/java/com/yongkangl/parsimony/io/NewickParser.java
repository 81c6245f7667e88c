package com.yongkangl.parsimony.io;

import com.yongkangl.parsimony.util.InvalidInputException;
import org.apache.commons.lang3.StringUtils;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads a rooted tree from a Newick line such as {@code ((A:1,B:2)ab:0.5,C);}.
 * Internal labels, branch lengths, bracketed comments and the trailing semicolon are optional.
 * Leaves without a branch length get {@link TreeNode#DEFAULT_BRANCH_LENGTH}.
 */
public class NewickParser {
    private final String input;
    private int position;

    public NewickParser(String input) {
        this.input = input == null ? "" : input.trim();
        this.position = 0;
    }

    public TreeNode parse() {
        if (input.isEmpty()) {
            throw new InvalidInputException("Empty tree");
        }
        TreeNode root = parseTree(null);
        skipWhitespace();
        if (position < input.length() && input.charAt(position) == ';') {
            position++;
        }
        skipWhitespace();
        if (position < input.length()) {
            throw error("Unexpected trailing input");
        }
        checkLeafNames(root);
        return root;
    }

    private TreeNode parseTree(TreeNode parent) {
        TreeNode root = new TreeNode(parent);
        skipWhitespace();
        if (peek() == '(') {
            position++; // Skip '('
            root.addChild(parseTree(root));
            skipWhitespace();
            while (peek() == ',') {
                position++; // Skip ','
                root.addChild(parseTree(root));
                skipWhitespace();
            }
            if (peek() != ')') {
                throw error("Expected ')'");
            }
            position++; // Skip ')'
        }
        String name = parseName();
        if (root.isLeaf() && StringUtils.isEmpty(name)) {
            throw error("Missing leaf name");
        }
        root.setName(name);
        skipComment();
        if (peek() == ':') {
            root.setBranchLength(parseBranchLength());
        }
        skipComment();
        return root;
    }

    private String parseName() {
        skipWhitespace();
        if (peek() == '\'') {
            StringBuilder name = new StringBuilder();
            int start = position;
            position++;
            while (true) {
                int end = input.indexOf('\'', position);
                if (end < 0) {
                    position = start;
                    throw error("Unterminated quoted name");
                }
                name.append(input, position, end);
                position = end + 1;
                // '' inside a quoted name stands for one quote
                if (position < input.length() && input.charAt(position) == '\'') {
                    name.append('\'');
                    position++;
                } else {
                    return name.toString();
                }
            }
        }
        int start = position;
        while (position < input.length() && !isDelimiter(input.charAt(position))) {
            position++;
        }
        return input.substring(start, position).trim();
    }

    private double parseBranchLength() {
        position++; // Skip ':'
        int start = position;
        while (position < input.length() && !isDelimiter(input.charAt(position))) {
            position++;
        }
        String number = input.substring(start, position).trim();
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Invalid branch length '" + number + "' at position " + start, e);
        }
    }

    private void skipComment() {
        skipWhitespace();
        if (peek() == '[') {
            int end = input.indexOf(']', position);
            if (end < 0) {
                throw error("Unterminated comment");
            }
            position = end + 1;
            skipWhitespace();
        }
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private char peek() {
        return position < input.length() ? input.charAt(position) : '\0';
    }

    private static boolean isDelimiter(char c) {
        return c == ',' || c == '(' || c == ')' || c == ':' || c == ';' || c == '[';
    }

    private static void checkLeafNames(TreeNode root) {
        Set<String> seen = new HashSet<>();
        for (String name : root.getLeafNames()) {
            if (!seen.add(name)) {
                throw new InvalidInputException("Duplicate leaf name '" + name + "'");
            }
        }
    }

    private InvalidInputException error(String message) {
        return new InvalidInputException(message + " at position " + position + " of '" + input + "'");
    }
}
