package com.yongkangl.phylonet.io;

public enum TreeFormat {
    NEWICK,
    NEXUS,
    PHYLOXML,
    NEXML;

    /** Case-insensitive lookup by name, e.g. {@code "phyloxml"}. */
    public static TreeFormat fromName(String name) {
        for (TreeFormat format : values()) {
            if (format.name().equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Invalid schema: " + name);
    }
}
