package com.yongkangl.phylonet.io;

import com.yongkangl.phylonet.tree.Node;
import com.yongkangl.phylonet.tree.Tree;
import org.apache.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.yongkangl.phylonet.io.XmlDocuments.childElements;

/**
 * Reads NeXML {@code tree} and {@code network} elements.
 *
 * <p>Each extra incoming edge of a node becomes a hybrid leaf under the edge's source, sharing a hybrid
 * id with the node itself.
 */
public class NeXMLReader {
    private static final Logger LOG = Logger.getLogger(NeXMLReader.class);

    private final Map<String, String> otuLabels;
    private int nextNodeID = 0;
    private int nextHybridID = 0;

    private NeXMLReader(Map<String, String> otuLabels) {
        this.otuLabels = otuLabels;
    }

    /**
     * @throws TreeFormatException if the document does not hold exactly one tree or network
     * @throws SkipTreeException   if no node is marked as root
     */
    public static Tree readNeXML(String neXML) {
        Document document = XmlDocuments.parse(neXML);
        List<Element> treeElements = treeElements(document);
        if (treeElements.isEmpty()) {
            throw new TreeFormatException("No tree element found in NeXML.");
        }
        if (treeElements.size() > 1) {
            throw new TreeFormatException("Multiple tree elements found in NeXML.");
        }
        return new NeXMLReader(otuLabels(document)).readTree(treeElements.get(0));
    }

    public static List<Tree> readTreesFromNeXML(String neXML) {
        Document document = XmlDocuments.parse(neXML);
        Map<String, String> otuLabels = otuLabels(document);
        List<Tree> trees = new ArrayList<>();
        for (Element treeElement : treeElements(document)) {
            try {
                trees.add(new NeXMLReader(otuLabels).readTree(treeElement));
            } catch (SkipTreeException e) {
                LOG.warn("Skipping NeXML tree " + treeElement.getAttribute("id") + ": " + e.getMessage());
            }
        }
        return trees;
    }

    private static List<Element> treeElements(Document document) {
        List<Element> elements = new ArrayList<>();
        for (Element trees : XmlDocuments.descendants(document, "trees")) {
            for (Element child : childElements(trees)) {
                String name = XmlDocuments.localName(child);
                if (name.equals("tree") || name.equals("network")) {
                    elements.add(child);
                }
            }
        }
        return elements;
    }

    private static Map<String, String> otuLabels(Document document) {
        Map<String, String> labels = new HashMap<>();
        for (Element otu : XmlDocuments.descendants(document, "otu")) {
            String id = otu.getAttribute("id");
            labels.put(id, otu.hasAttribute("label") ? otu.getAttribute("label") : id);
        }
        return labels;
    }

    private Tree readTree(Element treeElement) {
        Map<String, Node> nodes = new HashMap<>();
        Node root = null;
        for (Element nodeElement : childElements(treeElement, "node")) {
            Node node = new Node(nextNodeID++);
            if (nodeElement.hasAttribute("label")) {
                node.setLabel(nodeElement.getAttribute("label"));
            } else if (nodeElement.hasAttribute("otu")) {
                node.setLabel(otuLabels.get(nodeElement.getAttribute("otu")));
            }
            if ("true".equalsIgnoreCase(nodeElement.getAttribute("root")) && root == null) {
                root = node;
            }
            nodes.put(nodeElement.getAttribute("id"), node);
        }
        if (root == null) {
            throw new SkipTreeException("Unrooted tree.");
        }

        for (Element edge : childElements(treeElement, "edge")) {
            Node source = lookup(nodes, edge.getAttribute("source"));
            Node target = lookup(nodes, edge.getAttribute("target"));
            Double length = edge.hasAttribute("length")
                    ? XmlDocuments.parseLength(edge.getAttribute("length"), "edge length") : null;

            if (target == root) {
                throw new TreeFormatException("Edge " + edge.getAttribute("id") + " enters the root node.");
            }
            if (target.getParent() == null) {
                source.addChild(target);
                target.setBranchLength(length);
            } else {
                if (!target.isHybrid()) {
                    target.setHybridID(nextHybridID++);
                }
                Node destination = new Node(nextNodeID++);
                destination.setHybridID(target.getHybridID());
                destination.setBranchLength(length);
                source.addChild(destination);
            }
        }

        for (Element rootEdge : childElements(treeElement, "rootedge")) {
            if (rootEdge.hasAttribute("length")) {
                root.setBranchLength(XmlDocuments.parseLength(rootEdge.getAttribute("length"), "root edge length"));
            }
        }
        if (root.getBranchLength() != null && root.getBranchLength() == 0.0) {
            root.setBranchLength(null);
        }

        Tree tree = new Tree(root);
        tree.reassignNodeIDs();
        return tree;
    }

    private static Node lookup(Map<String, Node> nodes, String id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new TreeFormatException("Edge refers to unknown node " + id);
        }
        return node;
    }
}
