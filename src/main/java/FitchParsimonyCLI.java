import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yongkangl.parsimony.fitch.BatchReconstruction;
import com.yongkangl.parsimony.io.LeafStateParser;
import com.yongkangl.parsimony.io.NewickParser;
import com.yongkangl.parsimony.io.ReconstructionReportWriter;
import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.ParsimonyConfig;
import com.yongkangl.parsimony.model.Reconstruction;
import com.yongkangl.parsimony.util.InvalidInputException;
import com.yongkangl.parsimony.util.NodeAges;
import org.apache.commons.cli.*;

public class FitchParsimonyCLI {
    public static void main(String[] args) {
        Options options = new Options();
        options.addOption("t", "tree", true, "Newick tree file");
        options.addOption("s", "states", true, "JSON file of leaf states per trait");
        options.addOption("r", "trait", true, "Only reconstruct this trait");
        options.addOption("m", "maxAmbiguous", true, "Largest number of ambiguous nodes to enumerate");
        options.addOption("k", "keepDuplicates", false, "Report identical histories separately");
        options.addOption("n", "noVeto", false, "Keep histories whose origin is at the pseudo-root");
        options.addOption("p", "threads", true, "Number of threads");
        options.addOption("o", "output", true, "JSON report path");
        options.addOption("a", "ages", false, "Include node ages in the report");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = null;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println("Error parsing command line: " + e.getMessage());
            System.exit(1);
        }

        if (!cmd.hasOption("tree") || !cmd.hasOption("states")) {
            new HelpFormatter().printHelp("FitchParsimonyCLI", options);
            System.exit(1);
        }

        ParsimonyConfig.Builder builder = ParsimonyConfig.builder()
                .deduplicate(!cmd.hasOption("keepDuplicates"))
                .applyOriginVeto(!cmd.hasOption("noVeto"));
        try {
            if (cmd.hasOption("maxAmbiguous")) {
                builder.maxAmbiguousNodes(Integer.parseInt(cmd.getOptionValue("maxAmbiguous")));
            }
            if (cmd.hasOption("threads")) {
                builder.threads(Integer.parseInt(cmd.getOptionValue("threads")));
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid option value: " + e.getMessage());
            System.exit(1);
        }
        ParsimonyConfig config = builder.build();

        try {
            String newick = new String(Files.readAllBytes(Paths.get(cmd.getOptionValue("tree"))), StandardCharsets.UTF_8);
            TreeNode tree = new NewickParser(newick).parse();
            LeafStateParser states = new LeafStateParser(cmd.getOptionValue("states"));

            List<String> traits = cmd.hasOption("trait")
                    ? Collections.singletonList(cmd.getOptionValue("trait"))
                    : states.getTraits();
            List<Reconstruction> reconstructions = new BatchReconstruction(tree, states, config).run(traits);

            ReconstructionReportWriter writer = new ReconstructionReportWriter();
            ArrayNode reports = writer.toJson(reconstructions);
            Object report = reports;
            if (cmd.hasOption("ages")) {
                ObjectNode combined = reports.objectNode();
                combined.set("reconstructions", reports);
                combined.set("nodeAges", writer.nodeAgesToJson(NodeAges.of(tree)));
                report = combined;
            }

            if (cmd.hasOption("output")) {
                writer.write(report, new File(cmd.getOptionValue("output")));
            } else {
                System.out.println(writer.write(report));
            }
        } catch (IOException e) {
            System.err.println("Error reading or writing file: " + e.getMessage());
            System.exit(1);
        } catch (InvalidInputException e) {
            System.err.println("Invalid input: " + e.getMessage());
            System.exit(1);
        }
    }
}
