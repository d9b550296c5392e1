package com.yongkangl.phylonet.io;

import com.yongkangl.phylonet.tree.Tree;

import java.util.List;

/**
 * Reads every tree of a document in one of the supported formats.
 */
public class TreeReader {
    private TreeReader() {
    }

    public static List<Tree> read(String text) {
        return read(text, TreeFormat.NEWICK);
    }

    public static List<Tree> read(String text, TreeFormat format) {
        if (text.startsWith("http://") || text.startsWith("https://")) {
            throw new UnsupportedOperationException("Fetching trees from the internet is not yet supported");
        }
        switch (format) {
            case NEWICK:
                return NewickReader.readTreesFromNewick(text);
            case NEXUS:
                return NexusReader.readTreesFromNexus(text);
            case PHYLOXML:
                return PhyloXMLReader.readTreesFromPhyloXML(text);
            case NEXML:
                return NeXMLReader.readTreesFromNeXML(text);
            default:
                throw new IllegalArgumentException("Invalid schema: " + format);
        }
    }
}
