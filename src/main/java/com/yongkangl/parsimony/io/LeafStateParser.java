package com.yongkangl.parsimony.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.yongkangl.parsimony.model.CharacterState;
import com.yongkangl.parsimony.util.InvalidInputException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Leaf presence/absence calls, one map of leaf name to 0/1 per trait:
 * <pre>{"trait1": {"A": 1, "B": 0}, "trait2": {"A": 0, "B": 0}}</pre>
 */
public class LeafStateParser {
    private static final Logger logger = LogManager.getLogger(LeafStateParser.class);
    private static final TypeReference<LinkedHashMap<String, Map<String, Integer>>> TRAITS_TYPE =
            new TypeReference<LinkedHashMap<String, Map<String, Integer>>>() {};
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private final Map<String, Map<String, Integer>> traits;

    public LeafStateParser(String filePath) throws IOException {
        this(read(new File(filePath)));
    }

    public LeafStateParser(Map<String, Map<String, Integer>> traits) {
        this.traits = new LinkedHashMap<>(traits);
    }

    public static LeafStateParser fromJson(String json) throws IOException {
        try {
            return new LeafStateParser(MAPPER.readValue(json, TRAITS_TYPE));
        } catch (MismatchedInputException e) {
            throw new InvalidInputException("Leaf states must be 0 or 1: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Map<String, Integer>> read(File file) throws IOException {
        try {
            return MAPPER.readValue(file, TRAITS_TYPE);
        } catch (MismatchedInputException e) {
            throw new InvalidInputException("Leaf states in " + file + " must be 0 or 1: " + e.getOriginalMessage(), e);
        }
    }

    public List<String> getTraits() {
        return new ArrayList<>(traits.keySet());
    }

    public Map<String, Integer> queryTrait(String trait) {
        Map<String, Integer> states = traits.get(trait);
        if (states == null) {
            throw new InvalidInputException("Unknown trait '" + trait + "'");
        }
        return states;
    }

    public void assignStates(TreeNode root, String trait) {
        assignStates(root, queryTrait(trait));
    }

    /**
     * Sets every leaf's state from {@code states}; internal nodes are left untouched.
     */
    public static void assignStates(TreeNode root, Map<String, Integer> states) {
        Set<String> used = new HashSet<>();
        for (TreeNode leaf : root.getLeaves()) {
            Integer value = states.get(leaf.getName());
            if (value == null) {
                throw new InvalidInputException("No state for leaf '" + leaf.getName() + "'");
            }
            if (value != 0 && value != 1) {
                throw new InvalidInputException("State of leaf '" + leaf.getName() + "' must be 0 or 1, got " + value);
            }
            leaf.setState(CharacterState.of(value));
            used.add(leaf.getName());
        }
        for (String name : states.keySet()) {
            if (!used.contains(name)) {
                logger.warn("Ignoring state for '{}', which is not a leaf of the tree", name);
            }
        }
    }
}
