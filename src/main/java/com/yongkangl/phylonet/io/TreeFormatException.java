package com.yongkangl.phylonet.io;

/**
 * Input that cannot be read as a tree.
 */
public class TreeFormatException extends IllegalArgumentException {
    public TreeFormatException(String message) {
        super(message);
    }

    public TreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
