package com.yongkangl.parsimony.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yongkangl.parsimony.model.AnnotatedTree;
import com.yongkangl.parsimony.model.Reconstruction;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * JSON reports of reconstructions and node ages.
 */
public class ReconstructionReportWriter {
    private final ObjectMapper mapper;

    public ReconstructionReportWriter() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ArrayNode toJson(List<Reconstruction> reconstructions) {
        ArrayNode array = mapper.createArrayNode();
        for (Reconstruction reconstruction : reconstructions) {
            array.add(toJson(reconstruction));
        }
        return array;
    }

    public ObjectNode toJson(Reconstruction reconstruction) {
        ObjectNode node = mapper.createObjectNode();
        node.put("trait", reconstruction.getTrait());
        node.put("minChanges", reconstruction.getMinChanges());
        node.put("ambiguousNodes", reconstruction.getAmbiguousNodeCount());
        node.put("outcome", reconstruction.getOutcome().name());
        ArrayNode histories = node.putArray("histories");
        for (AnnotatedTree history : reconstruction.getHistories()) {
            ObjectNode entry = histories.addObject();
            entry.put("newick", history.toNewick());
            ArrayNode gains = entry.putArray("gains");
            history.getGains().forEach(gains::add);
            ArrayNode losses = entry.putArray("losses");
            history.getLosses().forEach(losses::add);
        }
        return node;
    }

    /**
     * @param ages as returned by {@link com.yongkangl.parsimony.util.NodeAges#of}
     */
    public ArrayNode nodeAgesToJson(Map<TreeNode, Double> ages) {
        ArrayNode array = mapper.createArrayNode();
        for (Map.Entry<TreeNode, Double> entry : ages.entrySet()) {
            ObjectNode node = array.addObject();
            node.put("name", entry.getKey().getName());
            node.put("leaf", entry.getKey().isLeaf());
            node.put("age", entry.getValue());
        }
        return array;
    }

    public String write(Object json) throws JsonProcessingException {
        return mapper.writeValueAsString(json);
    }

    public void write(Object json, File file) throws IOException {
        mapper.writeValue(file, json);
    }
}
