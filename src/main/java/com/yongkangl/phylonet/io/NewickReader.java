package com.yongkangl.phylonet.io;

import com.yongkangl.phylonet.tree.Node;
import com.yongkangl.phylonet.tree.Tree;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads extended Newick text into {@link Tree}s.
 */
public class NewickReader {
    private static final Logger LOG = Logger.getLogger(NewickReader.class);
    private static final Pattern TREE_SEPARATOR = Pattern.compile(";\\s*\\n");
    private static final NewickReader DEFAULT = new NewickReader(true);

    private final boolean rootedOnly;

    /**
     * @param rootedOnly whether a tree marked {@code [&U]} raises a {@link SkipTreeException}
     *                   instead of being read
     */
    public NewickReader(boolean rootedOnly) {
        this.rootedOnly = rootedOnly;
    }

    public static Tree readNewick(String newick) {
        return DEFAULT.read(newick);
    }

    public static List<Tree> readTreesFromNewick(String newick) {
        return DEFAULT.readAll(newick);
    }

    /**
     * Reads one tree. A root branch length of exactly zero is treated as absent.
     *
     * @throws SkipTreeException if the tree is marked unrooted and only rooted trees are accepted
     */
    public Tree read(String newick) {
        NewickParser parser = new NewickParser(newick);
        Node rootNode = parser.parse();
        if (rootedOnly && Boolean.FALSE.equals(parser.getRooted())) {
            throw new SkipTreeException("Unrooted tree.");
        }

        Tree tree = new Tree(rootNode);
        if (tree.getRoot().getBranchLength() != null && tree.getRoot().getBranchLength() == 0.0) {
            tree.getRoot().setBranchLength(null);
        }
        return tree;
    }

    /**
     * Reads trees separated by a semicolon at the end of a line. Skipped trees are logged and left out;
     * any other error aborts the whole read.
     */
    public List<Tree> readAll(String newick) {
        List<Tree> trees = new ArrayList<>();
        for (String line : TREE_SEPARATOR.split(newick)) {
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                trees.add(read(line));
            } catch (SkipTreeException e) {
                LOG.warn("Skipping Newick tree: " + e.getMessage());
            }
        }
        return trees;
    }
}
