import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.yongkangl.phylonet.io.TreeFormat;
import com.yongkangl.phylonet.io.TreeReader;
import com.yongkangl.phylonet.io.TreeSummary;
import com.yongkangl.phylonet.tree.Tree;
import org.apache.commons.cli.*;
import org.apache.log4j.Logger;

public class SummariseTrees {
    private static final Logger LOG = Logger.getLogger(SummariseTrees.class);

    public static void main(String[] args) {
        Options options = new Options();
        options.addOption("f", "file", true, "Input file path");
        options.addOption("s", "schema", true, "Input format: newick, nexus, phyloxml or nexml");
        options.addOption("l", "ladderise", false, "Ladderise before summarising");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = null;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            System.err.println("Error parsing command line: " + e.getMessage());
            System.exit(1);
        }

        String filePath = "trees.nwk";
        TreeFormat format = TreeFormat.NEWICK;

        if (cmd.hasOption("file")) {
            filePath = cmd.getOptionValue("file");
        }
        if (cmd.hasOption("schema")) {
            try {
                format = TreeFormat.fromName(cmd.getOptionValue("schema"));
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                System.exit(1);
            }
        }

        List<Tree> trees = null;
        try {
            String text = new String(Files.readAllBytes(Paths.get(filePath)), StandardCharsets.UTF_8);
            trees = TreeReader.read(text, format);
        } catch (IOException e) {
            System.err.println("Error reading file: " + e.getMessage());
            System.exit(1);
        }
        LOG.info("Read " + trees.size() + " tree(s) from " + filePath);

        for (Tree tree : trees) {
            if (cmd.hasOption("ladderise")) {
                tree.ladderise();
            }
            try {
                System.out.println(TreeSummary.of(tree).toJson());
            } catch (JsonProcessingException e) {
                System.err.println("Error writing summary: " + e.getMessage());
                System.exit(1);
            }
        }
    }
}
