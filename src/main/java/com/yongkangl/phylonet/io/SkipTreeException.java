package com.yongkangl.phylonet.io;

/**
 * Signals that a tree should be left out of a batch (for example because it is unrooted) while the
 * remaining trees are still read.
 */
public class SkipTreeException extends RuntimeException {
    public SkipTreeException(String message) {
        super(message);
    }
}
