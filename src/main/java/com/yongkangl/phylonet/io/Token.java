package com.yongkangl.phylonet.io;

/**
 * A lexed token: its kind, its text (unquoted for strings) and its offset in the source text.
 */
public class Token {
    private final TokenKind kind;
    private final String text;
    private final int offset;

    public Token(TokenKind kind, String text, int offset) {
        this.kind = kind;
        this.text = text;
        this.offset = offset;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + offset;
    }
}
