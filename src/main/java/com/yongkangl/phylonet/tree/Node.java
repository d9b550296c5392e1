package com.yongkangl.phylonet.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * A vertex of a phylogenetic tree or network.
 *
 * <p>Annotation values are {@code String}, {@code null} or a {@code List} of such values.
 */
public class Node {
    private int id;
    private String label;
    private Double branchLength;
    private double height = Double.NaN;
    private double rttDist = Double.NaN;
    private Node parent;
    private final List<Node> children;
    private Integer hybridID;
    private String hybridType;
    private final Map<String, Object> annotation;

    public Node(int id) {
        this.id = id;
        this.children = new ArrayList<>();
        this.annotation = new LinkedHashMap<>();
    }

    public void addChild(Node child) {
        child.parent = this;
        children.add(child);
    }

    public void removeChild(Node child) {
        if (children.remove(child)) {
            child.parent = null;
        }
    }

    void resetChildren(List<Node> newChildren) {
        for (Node child : children) {
            if (child.parent == this) {
                child.parent = null;
            }
        }
        children.clear();
        for (Node child : newChildren) {
            addChild(child);
        }
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isHybrid() {
        return hybridID != null;
    }

    /**
     * Visits this node and its descendants in pre-order (parent first, siblings left to right)
     * and collects the non-null results of {@code visitor}.
     *
     * <p>Children are read after the visitor returns, so a visitor may reorder them.
     */
    public <T> List<T> applyPreOrder(Function<Node, T> visitor) {
        List<T> results = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            T result = visitor.apply(node);
            if (result != null) {
                results.add(result);
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return results;
    }

    public int getTipCount() {
        return applyPreOrder(node -> node.isLeaf() ? node : null).size();
    }

    public int getId() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public Double getBranchLength() {
        return branchLength;
    }

    public void setBranchLength(Double branchLength) {
        this.branchLength = branchLength;
    }

    public double getHeight() {
        return height;
    }

    public void setHeight(double height) {
        this.height = height;
    }

    public double getRttDist() {
        return rttDist;
    }

    public void setRttDist(double rttDist) {
        this.rttDist = rttDist;
    }

    public Node getParent() {
        return parent;
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /** Reorders children in place; the list must hold the same nodes. */
    void sortChildren(Comparator<Node> comparator) {
        children.sort(comparator);
    }

    public int getChildCount() {
        return children.size();
    }

    public Node getChild(int i) {
        return children.get(i);
    }

    public Integer getHybridID() {
        return hybridID;
    }

    public void setHybridID(Integer hybridID) {
        this.hybridID = hybridID;
    }

    public String getHybridType() {
        return hybridType;
    }

    public void setHybridType(String hybridType) {
        this.hybridType = hybridType;
    }

    public Map<String, Object> getAnnotation() {
        return annotation;
    }

    /** Label if present, otherwise the id as a string. */
    public String getLabelOrId() {
        return label != null ? label : Integer.toString(id);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Node{id=").append(id);
        if (label != null) {
            sb.append(", label=").append(label);
        }
        if (hybridID != null) {
            sb.append(", hybridID=").append(hybridID);
        }
        if (branchLength != null) {
            sb.append(", branchLength=").append(branchLength);
        }
        return sb.append("}").toString();
    }
}
