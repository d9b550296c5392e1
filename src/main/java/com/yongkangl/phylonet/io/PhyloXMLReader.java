package com.yongkangl.phylonet.io;

import com.yongkangl.phylonet.tree.Node;
import com.yongkangl.phylonet.tree.Tree;
import org.apache.log4j.Logger;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static com.yongkangl.phylonet.io.XmlDocuments.childElements;
import static com.yongkangl.phylonet.io.XmlDocuments.localName;

/**
 * Reads phyloXML {@code phylogeny} elements. Names, branch lengths, taxonomy, sequence, confidence and
 * property elements are kept; everything else is ignored.
 */
public class PhyloXMLReader {
    private static final Logger LOG = Logger.getLogger(PhyloXMLReader.class);

    private int nextNodeID = 0;

    private PhyloXMLReader() {
    }

    /**
     * @throws TreeFormatException if the document does not hold exactly one phylogeny
     * @throws SkipTreeException   if the phylogeny is marked unrooted
     */
    public static Tree readPhyloXML(String phyloXML) {
        List<Element> phylogenies = XmlDocuments.descendants(XmlDocuments.parse(phyloXML), "phylogeny");
        if (phylogenies.isEmpty()) {
            throw new TreeFormatException("No phylogeny element found in phyloXML.");
        }
        if (phylogenies.size() > 1) {
            throw new TreeFormatException("Multiple phylogeny elements found in phyloXML.");
        }
        return new PhyloXMLReader().readPhylogeny(phylogenies.get(0));
    }

    public static List<Tree> readTreesFromPhyloXML(String phyloXML) {
        List<Tree> trees = new ArrayList<>();
        for (Element phylogeny : XmlDocuments.descendants(XmlDocuments.parse(phyloXML), "phylogeny")) {
            try {
                trees.add(new PhyloXMLReader().readPhylogeny(phylogeny));
            } catch (SkipTreeException e) {
                LOG.warn("Skipping phyloXML tree: " + e.getMessage());
            }
        }
        return trees;
    }

    private Tree readPhylogeny(Element phylogeny) {
        if ("false".equalsIgnoreCase(phylogeny.getAttribute("rooted"))) {
            throw new SkipTreeException("Unrooted tree.");
        }

        // A phylogeny normally wraps a single root clade
        List<Element> clades = childElements(phylogeny, "clade");
        Element rootElement = clades.size() == 1 ? clades.get(0) : phylogeny;

        Node root = walkClade(null, rootElement);
        if (root.getBranchLength() != null && root.getBranchLength() == 0.0) {
            root.setBranchLength(null);
        }
        return new Tree(root);
    }

    private Node walkClade(Node parent, Element cladeElement) {
        Node node = new Node(nextNodeID++);
        if (parent != null) {
            parent.addChild(node);
        }

        for (Element child : childElements(cladeElement)) {
            switch (localName(child)) {
                case "clade":
                    walkClade(node, child);
                    break;
                case "name":
                    String name = child.getTextContent().trim();
                    if (!name.isEmpty()) {
                        node.setLabel(name);
                    }
                    break;
                case "taxonomy":
                    annotate(node, "taxonomy", child);
                    break;
                case "sequence":
                    annotate(node, "sequence", child);
                    break;
                case "confidence":
                    node.getAnnotation().put("confidence_" + child.getAttribute("type"), child.getTextContent().trim());
                    break;
                case "branch_length":
                    node.setBranchLength(XmlDocuments.parseLength(child.getTextContent(), "branch length"));
                    break;
                case "property":
                    if (!child.getAttribute("ref").isEmpty()) {
                        node.getAnnotation().put(child.getAttribute("ref"), child.getTextContent().trim());
                    }
                    break;
                default:
                    break;
            }
        }

        if (cladeElement.hasAttribute("branch_length")) {
            node.setBranchLength(XmlDocuments.parseLength(cladeElement.getAttribute("branch_length"), "branch length"));
        }
        return node;
    }

    private static void annotate(Node node, String prefix, Element element) {
        for (Element child : childElements(element)) {
            node.getAnnotation().put(prefix + "_" + localName(child), child.getTextContent().trim());
        }
    }
}
