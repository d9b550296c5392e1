package com.yongkangl.phylonet.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yongkangl.phylonet.tree.Node;
import com.yongkangl.phylonet.tree.Tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON view of a tree: counts, lengths, hybrid groups and one entry per node in pre-order.
 * Undefined heights and branch lengths are left out.
 */
@JsonPropertyOrder({"tipCount", "nodeCount", "timeTree", "totalBranchLength", "tipLabels",
        "rootToTipDistances", "hybridGroups", "nodes"})
public class TreeSummary {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int tipCount;
    private final int nodeCount;
    private final boolean timeTree;
    private final double totalBranchLength;
    private final List<String> tipLabels;
    private final List<Double> rootToTipDistances;
    private final Map<Integer, List<Integer>> hybridGroups;
    private final List<NodeSummary> nodes;

    private TreeSummary(Tree tree) {
        this.tipCount = tree.getLeafList().size();
        this.nodeCount = tree.getNodeList().size();
        this.timeTree = tree.isTimeTree();
        this.totalBranchLength = tree.getTotalBranchLength();
        this.tipLabels = tree.getTipLabels();
        this.rootToTipDistances = tree.getRTTDist();
        this.hybridGroups = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<Node>> e : tree.getRecombEdgeMap().entrySet()) {
            List<Integer> ids = new ArrayList<>();
            for (Node node : e.getValue()) {
                ids.add(node.getId());
            }
            hybridGroups.put(e.getKey(), ids);
        }
        this.nodes = new ArrayList<>();
        for (Node node : tree.getNodeList()) {
            nodes.add(new NodeSummary(node));
        }
    }

    public static TreeSummary of(Tree tree) {
        return new TreeSummary(tree);
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }

    public int getTipCount() {
        return tipCount;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public boolean isTimeTree() {
        return timeTree;
    }

    public double getTotalBranchLength() {
        return totalBranchLength;
    }

    public List<String> getTipLabels() {
        return tipLabels;
    }

    public List<Double> getRootToTipDistances() {
        return rootToTipDistances;
    }

    public Map<Integer, List<Integer>> getHybridGroups() {
        return hybridGroups;
    }

    public List<NodeSummary> getNodes() {
        return nodes;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonPropertyOrder({"id", "label", "parent", "branchLength", "height", "hybridID", "annotation"})
    public static class NodeSummary {
        private final int id;
        private final String label;
        private final Integer parent;
        private final Double branchLength;
        private final Double height;
        private final Integer hybridID;
        private final Map<String, Object> annotation;

        NodeSummary(Node node) {
            this.id = node.getId();
            this.label = node.getLabel();
            this.parent = node.getParent() != null ? node.getParent().getId() : null;
            this.branchLength = node.getBranchLength();
            this.height = Double.isNaN(node.getHeight()) ? null : node.getHeight();
            this.hybridID = node.getHybridID();
            this.annotation = node.getAnnotation();
        }

        @JsonInclude(JsonInclude.Include.ALWAYS)
        public int getId() {
            return id;
        }

        public String getLabel() {
            return label;
        }

        public Integer getParent() {
            return parent;
        }

        public Double getBranchLength() {
            return branchLength;
        }

        public Double getHeight() {
            return height;
        }

        public Integer getHybridID() {
            return hybridID;
        }

        public Map<String, Object> getAnnotation() {
            return annotation;
        }
    }
}
