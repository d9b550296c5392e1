package com.yongkangl.phylonet.tree;

/**
 * Thrown when the node graph violates a tree/network invariant or an algorithm's precondition fails.
 */
public class StructuralException extends IllegalStateException {
    public StructuralException(String message) {
        super(message);
    }
}
