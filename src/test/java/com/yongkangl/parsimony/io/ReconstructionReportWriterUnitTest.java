package com.yongkangl.parsimony.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yongkangl.parsimony.fitch.FitchParsimony;
import com.yongkangl.parsimony.model.Reconstruction;
import com.yongkangl.parsimony.util.NodeAges;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import static com.yongkangl.parsimony.TreeFixtures.tree;

public final class ReconstructionReportWriterUnitTest {

    @Test
    public void testReport() throws IOException {
        FitchParsimony fitch = new FitchParsimony();
        Reconstruction resolved = fitch.reconstruct("wings", tree("((A,B)ab,C)root;", 1, 1, 0));
        Reconstruction vetoed = fitch.reconstruct("eyes", tree("((A,B)ab,C)root;", 1, 1, 1));

        ReconstructionReportWriter writer = new ReconstructionReportWriter();
        JsonNode report = new ObjectMapper().readTree(writer.write(writer.toJson(Arrays.asList(resolved, vetoed))));

        Assert.assertEquals(report.size(), 2);
        JsonNode first = report.get(0);
        Assert.assertEquals(first.get("trait").asText(), "wings");
        Assert.assertEquals(first.get("minChanges").asInt(), 1);
        Assert.assertEquals(first.get("ambiguousNodes").asInt(), 1);
        Assert.assertEquals(first.get("outcome").asText(), "RESOLVED");
        Assert.assertEquals(first.get("histories").size(), 1);
        Assert.assertEquals(first.get("histories").get(0).get("gains").get(0).asText(), "ab");
        Assert.assertEquals(first.get("histories").get(0).get("losses").size(), 0);
        Assert.assertEquals(first.get("histories").get(0).get("newick").asText(), resolved.getHistories().get(0).toNewick());

        JsonNode second = report.get(1);
        Assert.assertEquals(second.get("outcome").asText(), "ORIGIN_VETOED");
        Assert.assertEquals(second.get("histories").size(), 0);
    }

    @Test
    public void testNodeAgesToFile() throws IOException {
        TreeNode root = new NewickParser("((A:1,B:2)x,C)r;").parse();
        ReconstructionReportWriter writer = new ReconstructionReportWriter();
        File file = File.createTempFile("ages", ".json");
        file.deleteOnExit();

        writer.write(writer.nodeAgesToJson(NodeAges.of(root)), file);

        JsonNode ages = new ObjectMapper().readTree(file);
        Assert.assertEquals(ages.size(), 5);
        JsonNode last = ages.get(4);
        Assert.assertEquals(last.get("name").asText(), "r");
        Assert.assertFalse(last.get("leaf").asBoolean());
        Assert.assertEquals(last.get("age").asDouble(), 3.0, 1e-9);
    }
}
