import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import com.yongkangl.phylonet.io.NewickWriter;
import com.yongkangl.phylonet.io.TreeFormat;
import com.yongkangl.phylonet.io.TreeReader;
import com.yongkangl.phylonet.tree.Node;
import com.yongkangl.phylonet.tree.Tree;
import org.apache.commons.cli.*;
import org.apache.log4j.Logger;

public class RerootTrees {
    private static final Logger LOG = Logger.getLogger(RerootTrees.class);

    public static void main(String[] args) {
        Options options = new Options();
        options.addOption("f", "file", true, "Input file path");
        options.addOption("s", "schema", true, "Input format: newick, nexus, phyloxml or nexml");
        options.addOption("n", "node", true, "Label (or id) of the node above which to reroot");
        options.addOption("p", "prop", true, "Fraction of the branch kept on the node side");
        options.addOption("l", "ladderise", false, "Ladderise after rerooting");
        options.addOption("o", "output", true, "Output file path");

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
        Double prop = null;

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
        if (cmd.hasOption("prop")) {
            try {
                prop = Double.parseDouble(cmd.getOptionValue("prop"));
            } catch (NumberFormatException e) {
                System.err.println("Invalid number for prop");
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

        PrintStream out = System.out;
        try {
            if (cmd.hasOption("output")) {
                out = new PrintStream(cmd.getOptionValue("output"), StandardCharsets.UTF_8);
            }
            for (Tree tree : trees) {
                if (cmd.hasOption("node")) {
                    Node edgeBaseNode = findNode(tree, cmd.getOptionValue("node"));
                    if (edgeBaseNode == null) {
                        System.err.println("No node " + cmd.getOptionValue("node") + " in tree");
                        System.exit(1);
                    }
                    tree.reroot(edgeBaseNode, prop);
                }
                if (cmd.hasOption("ladderise")) {
                    tree.ladderise();
                }
                out.println(NewickWriter.write(tree));
            }
        } catch (IOException e) {
            System.err.println("Error writing file: " + e.getMessage());
            System.exit(1);
        } finally {
            if (out != System.out) {
                out.close();
            }
        }
        LOG.info("Wrote " + trees.size() + " tree(s)");
    }

    private static Node findNode(Tree tree, String name) {
        Node node = tree.getNodeByLabel(name);
        if (node == null) {
            for (Node candidate : tree.getNodeList()) {
                if (name.equals(candidate.getLabel())) {
                    return candidate;
                }
            }
            try {
                node = tree.getNode(Integer.parseInt(name));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return node;
    }
}
