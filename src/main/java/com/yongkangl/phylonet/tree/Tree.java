package com.yongkangl.phylonet.tree;

import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A rooted phylogenetic tree or network owning every node reachable from its root.
 *
 * <p>Node lists and lookup maps are computed on first use and discarded by {@link #clearCaches()}
 * whenever the topology changes. Instances are not thread-safe.
 */
public class Tree {
    private static final Logger LOG = Logger.getLogger(Tree.class);

    private Node root;
    private boolean timeTree = false;

    private List<Node> nodeList;
    private Map<Integer, Node> nodeIDMap;
    private Map<String, Node> labelNodeMap;
    private List<Node> leafList;
    private Map<Integer, List<Node>> recombEdgeMap;

    public Tree(Node root) {
        this.root = root;
        computeNodeAges();
    }

    public Node getRoot() {
        return root;
    }

    public boolean isTimeTree() {
        return timeTree;
    }

    /** Heights are measured back from the youngest node; below a missing branch length they are NaN. */
    public void computeNodeAges() {
        List<Double> heights = root.applyPreOrder(node -> {
            if (node == root) {
                node.setHeight(0.0);
            } else if (node.getBranchLength() != null) {
                node.setHeight(node.getParent().getHeight() - node.getBranchLength());
            } else {
                node.setHeight(Double.NaN);
            }
            return node.getHeight();
        });

        double youngestHeight = Double.POSITIVE_INFINITY;
        for (double height : heights) {
            youngestHeight = Math.min(youngestHeight, height);
        }

        timeTree = !Double.isNaN(youngestHeight)
                && (heights.size() > 1 || root.getBranchLength() != null);

        for (Node node : getNodeList()) {
            node.setHeight(node.getHeight() - youngestHeight);
        }
    }

    // stable: ties keep their order
    public void ladderise() {
        Map<Node, Integer> tipCounts = new HashMap<>();
        List<Node> preOrder = root.applyPreOrder(node -> node);
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            Node node = preOrder.get(i);
            int count = node.isLeaf() ? 1 : 0;
            for (Node child : node.getChildren()) {
                count += tipCounts.get(child);
            }
            tipCounts.put(node, count);
        }

        root.applyPreOrder(node -> {
            node.sortChildren(Comparator.comparingInt(tipCounts::get));
            return null;
        });
        clearCaches();
    }

    public List<Double> getBranchLengths() {
        List<Double> branchLengths = new ArrayList<>();
        for (Node node : getNodeList()) {
            branchLengths.add(node.getBranchLength());
        }
        return branchLengths;
    }

    /** Root-to-tip distances of the leaves in pre-order. Undefined branch lengths count as zero. */
    public List<Double> getRTTDist() {
        return root.applyPreOrder(node -> {
            if (node == root) {
                node.setRttDist(0.0);
            } else {
                double branchLength = node.getBranchLength() != null ? node.getBranchLength() : 0.0;
                node.setRttDist(node.getParent().getRttDist() + branchLength);
            }
            return node.isLeaf() ? node.getRttDist() : null;
        });
    }

    /** Renumbers nodes 0..n-1 in pre-order. Invalidates id lookups held elsewhere. */
    public void reassignNodeIDs() {
        int nodeID = 0;
        for (Node node : getNodeList()) {
            node.setId(nodeID++);
        }
        nodeIDMap = null;
        labelNodeMap = null;
    }

    public void clearCaches() {
        nodeList = null;
        nodeIDMap = null;
        labelNodeMap = null;
        leafList = null;
        recombEdgeMap = null;
    }

    public List<Node> getNodeList() {
        if (nodeList == null) {
            nodeList = Collections.unmodifiableList(root.applyPreOrder(node -> node));
        }
        return nodeList;
    }

    public Node getNode(int nodeID) {
        if (nodeIDMap == null) {
            nodeIDMap = new HashMap<>();
            for (Node node : getNodeList()) {
                nodeIDMap.put(node.getId(), node);
            }
        }
        return nodeIDMap.get(nodeID);
    }

    public List<Node> getLeafList() {
        if (leafList == null) {
            leafList = Collections.unmodifiableList(root.applyPreOrder(node -> node.isLeaf() ? node : null));
        }
        return leafList;
    }

    /** Finds a leaf by label, or by its id written as a string when the leaf has no label. */
    public Node getNodeByLabel(String label) {
        if (labelNodeMap == null) {
            labelNodeMap = new HashMap<>();
            for (Node leaf : getLeafList()) {
                labelNodeMap.put(leaf.getLabelOrId(), leaf);
            }
        }
        return labelNodeMap.get(label);
    }

    /**
     * Groups hybrid nodes by hybrid id. Each entry lists the internal source node first, followed by
     * the leaf destinations. Groups made only of leaves are kept as they are.
     *
     * @throws StructuralException if an internal hybrid node has no leaf partner
     */
    public Map<Integer, List<Node>> getRecombEdgeMap() {
        if (recombEdgeMap == null) {
            List<Node> hybridNodeList = root.applyPreOrder(node -> node.isHybrid() ? node : null);

            Map<Integer, Node> srcHybridIDMap = new HashMap<>();
            Map<Integer, List<Node>> destHybridIDMap = new HashMap<>();
            for (Node node : hybridNodeList) {
                if (node.isLeaf()) {
                    destHybridIDMap.computeIfAbsent(node.getHybridID(), k -> new ArrayList<>()).add(node);
                } else {
                    srcHybridIDMap.put(node.getHybridID(), node);
                }
            }

            Map<Integer, List<Node>> edges = new TreeMap<>();
            for (Map.Entry<Integer, Node> e : srcHybridIDMap.entrySet()) {
                List<Node> destNodes = destHybridIDMap.get(e.getKey());
                if (destNodes == null) {
                    throw new StructuralException("Extended Newick error: hybrid nodes must come in groups of 2 or more "
                            + "(hybrid id " + e.getKey() + ").");
                }
                List<Node> group = new ArrayList<>();
                group.add(e.getValue());
                group.addAll(destNodes);
                edges.put(e.getKey(), Collections.unmodifiableList(group));
            }

            // Leaf-only recombinations
            for (Map.Entry<Integer, List<Node>> e : destHybridIDMap.entrySet()) {
                if (!edges.containsKey(e.getKey())) {
                    edges.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
                }
            }
            recombEdgeMap = Collections.unmodifiableMap(edges);
        }
        return recombEdgeMap;
    }

    /**
     * Returns a tree rooted at {@code node}. The nodes are shared, not copied, and their heights are
     * recomputed relative to the new root; call {@link #computeNodeAges()} on this tree to restore them.
     */
    public Tree getSubtree(Node node) {
        return new Tree(node);
    }

    /**
     * Most recent common ancestor of {@code nodes}: {@code null} for an empty collection, the parent
     * (or the node itself when it is a root) for a single node.
     */
    public Node getMRCA(Collection<Node> nodes) {
        int leafCount = nodes.size();
        if (leafCount == 0) {
            return null;
        }
        if (leafCount == 1) {
            Node node = nodes.iterator().next();
            return node.getParent() != null ? node.getParent() : node;
        }

        Map<Node, Integer> visitCounts = new HashMap<>();
        List<Node> nodesToCheck = new ArrayList<>(nodes);

        while (!nodesToCheck.isEmpty()) {
            List<Node> nextNodes = new ArrayList<>();
            for (Node node : nodesToCheck) {
                int count = visitCounts.getOrDefault(node, 0) + 1;
                if (count == leafCount) {
                    return node;
                }
                visitCounts.put(node, count);
                if (node.getParent() != null) {
                    nextNodes.add(node.getParent());
                }
            }
            nodesToCheck = nextNodes;
        }
        return null;
    }

    public List<String> getTipLabels() {
        List<String> tips = new ArrayList<>();
        for (Node leaf : getLeafList()) {
            tips.add(leaf.getLabelOrId());
        }
        return tips;
    }

    public List<String> getTipLabels(Node node) {
        return node.applyPreOrder(n -> n.isLeaf() ? n.getLabelOrId() : null);
    }

    public double getTotalBranchLength() {
        double totalLength = 0.0;
        for (Node node : getNodeList()) {
            if (node.getBranchLength() != null) {
                totalLength += node.getBranchLength();
            }
        }
        return totalLength;
    }

    public void reroot(Node edgeBaseNode) {
        reroot(edgeBaseNode, null);
    }

    /**
     * Reroots on the branch above {@code edgeBaseNode}, {@code prop} of it staying on the
     * {@code edgeBaseNode} side ({@code null} or outside [0, 1] splits it in half). Reticulations met on
     * the way are re-expressed as hybrid source/leaf pairs and hybrid leaf lengths are adjusted to end at
     * the height of their source. A failed reroot leaves the tree as it was.
     *
     * @throws StructuralException if {@code edgeBaseNode} is the root or the graph is inconsistent
     */
    public void reroot(Node edgeBaseNode, Double prop) {
        Node edgeBaseNodeP = edgeBaseNode.getParent();
        if (edgeBaseNodeP == null) {
            throw new StructuralException("Cannot reroot above a node without a parent: " + edgeBaseNode);
        }

        List<NodeState> savedStates = root.applyPreOrder(NodeState::new);
        Node oldRoot = root;
        try {
            reverseToward(edgeBaseNode, edgeBaseNodeP, prop);
        } catch (RuntimeException e) {
            for (NodeState state : savedStates) {
                state.restore();
            }
            root = oldRoot;
            clearCaches();
            computeNodeAges();
            throw e;
        }
    }

    private void reverseToward(Node edgeBaseNode, Node edgeBaseNodeP, Double prop) {
        recombEdgeMap = null;
        Map<Integer, List<Node>> currentRecombEdgeMap = getRecombEdgeMap();

        Node oldRoot = root;
        root = new Node(0);

        edgeBaseNodeP.removeChild(edgeBaseNode);
        root.addChild(edgeBaseNode);

        Double remainder = edgeBaseNode.getBranchLength();
        if (remainder != null) {
            double totalBL = remainder;
            if (prop != null && prop >= 0 && prop <= 1) {
                edgeBaseNode.setBranchLength(totalBL * prop);
                remainder = totalBL - edgeBaseNode.getBranchLength();
            } else {
                edgeBaseNode.setBranchLength(totalBL / 2);
                remainder = edgeBaseNode.getBranchLength();
            }
        }

        new EdgeReversal(currentRecombEdgeMap).reverse(edgeBaseNodeP, root, remainder);

        if (oldRoot.getChildCount() == 1 && !oldRoot.isHybrid()) {
            spliceOut(oldRoot);
        }

        clearCaches();
        computeNodeAges();
        reassignNodeIDs();

        for (List<Node> group : getRecombEdgeMap().values()) {
            Node srcNode = group.get(0);
            for (int i = 1; i < group.size(); i++) {
                Node destNode = group.get(i);
                if (destNode.getBranchLength() == null) {
                    throw new StructuralException("Hybrid destination without branch length: " + destNode);
                }
                if (Double.isNaN(destNode.getHeight()) || Double.isNaN(srcNode.getHeight())) {
                    throw new StructuralException("Undefined height in hybrid group " + srcNode.getHybridID());
                }
                destNode.setBranchLength(destNode.getBranchLength() + destNode.getHeight() - srcNode.getHeight());
            }
        }
        computeNodeAges();
    }

    /**
     * Merges the old root's branch into its only child. Two undefined lengths merge to an undefined
     * length, which extends the usual rule that both must be defined; one undefined length is an error.
     */
    private void spliceOut(Node oldRoot) {
        Node child = oldRoot.getChild(0);
        Node parent = oldRoot.getParent();
        if (parent == null) {
            throw new StructuralException("Root with a single child left after rerooting.");
        }
        Double merged;
        if (child.getBranchLength() == null && oldRoot.getBranchLength() == null) {
            merged = null;
        } else if (child.getBranchLength() == null || oldRoot.getBranchLength() == null) {
            throw new StructuralException("Cannot merge a defined and an undefined branch length at " + oldRoot);
        } else {
            merged = child.getBranchLength() + oldRoot.getBranchLength();
        }
        parent.removeChild(oldRoot);
        oldRoot.removeChild(child);
        parent.addChild(child);
        child.setBranchLength(merged);
        LOG.debug("Removed singleton node left by old root " + oldRoot);
    }

    private static final class NodeState {
        private final Node node;
        private final int id;
        private final Double branchLength;
        private final Integer hybridID;
        private final String hybridType;
        private final List<Node> children;

        NodeState(Node node) {
            this.node = node;
            this.id = node.getId();
            this.branchLength = node.getBranchLength();
            this.hybridID = node.getHybridID();
            this.hybridType = node.getHybridType();
            this.children = new ArrayList<>(node.getChildren());
        }

        void restore() {
            node.resetChildren(children);
            node.setId(id);
            node.setBranchLength(branchLength);
            node.setHybridID(hybridID);
            node.setHybridType(hybridType);
        }
    }

    /**
     * Walks from the old parent of the rerooting edge towards the old root, reversing each edge. A node
     * reached a second time closes a reticulation and is answered with a new hybrid leaf.
     */
    private class EdgeReversal {
        private final Map<Integer, List<Node>> originalRecombEdgeMap;
        private final Set<Integer> usedHybridIDs;
        private final Set<Node> seenNodes = Collections.newSetFromMap(new IdentityHashMap<>());

        EdgeReversal(Map<Integer, List<Node>> originalRecombEdgeMap) {
            this.originalRecombEdgeMap = originalRecombEdgeMap;
            this.usedHybridIDs = new HashSet<>(originalRecombEdgeMap.keySet());
        }

        void reverse(Node node, Node prevNode, Double branchLength) {
            if (node == null) {
                return;
            }

            if (!seenNodes.add(node)) {
                Node newHybrid = new Node(0);
                if (node.isHybrid()) {
                    newHybrid.setHybridID(node.getHybridID());
                    newHybrid.setHybridType(node.getHybridType());
                } else {
                    int newHybridID = 0;
                    while (usedHybridIDs.contains(newHybridID)) {
                        newHybridID++;
                    }
                    node.setHybridID(newHybridID);
                    newHybrid.setHybridID(newHybridID);
                    usedHybridIDs.add(newHybridID);
                }
                newHybrid.setBranchLength(branchLength);
                prevNode.addChild(newHybrid);
                LOG.debug("Closed reticulation at " + node + " with hybrid id " + newHybrid.getHybridID());
                return;
            }

            Node nodeP = node.getParent();
            if (nodeP != null) {
                nodeP.removeChild(node);
            }
            prevNode.addChild(node);

            Double carried = node.getBranchLength();
            node.setBranchLength(branchLength);

            reverse(nodeP, node, carried);

            if (isOriginalSource(node)) {
                List<Node> group = originalRecombEdgeMap.get(node.getHybridID());
                List<Node> destNodes = group.subList(1, group.size());
                List<Node> destNodePs = new ArrayList<>();
                for (Node destNode : destNodes) {
                    destNodePs.add(destNode.getParent());
                }

                // No longer a reticulation point once its destinations are folded in
                node.setHybridID(null);
                node.setHybridType(null);

                for (int i = 0; i < destNodes.size(); i++) {
                    Node destNodeP = destNodePs.get(i);
                    if (destNodeP != null) {
                        destNodeP.removeChild(destNodes.get(i));
                    }
                    reverse(destNodeP, node, destNodes.get(i).getBranchLength());
                }
            }
        }

        private boolean isOriginalSource(Node node) {
            if (!node.isHybrid()) {
                return false;
            }
            List<Node> group = originalRecombEdgeMap.get(node.getHybridID());
            return group != null && group.get(0) == node;
        }
    }
}
