package com.yongkangl.phylonet.io;

/**
 * Offsets are {@code char} indexes into the Java string, not byte offsets into the encoded input.
 */
public class LexException extends TreeFormatException {
    private final char character;
    private final int offset;

    public LexException(char character, int offset) {
        super("Error reading character " + character + " at position " + offset);
        this.character = character;
        this.offset = offset;
    }

    public char getCharacter() {
        return character;
    }

    public int getOffset() {
        return offset;
    }
}
