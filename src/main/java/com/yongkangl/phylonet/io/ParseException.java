package com.yongkangl.phylonet.io;

import org.apache.commons.lang3.StringUtils;

/**
 * A token sequence that does not follow the extended Newick grammar.
 */
public class ParseException extends TreeFormatException {
    static final int CONTEXT_FLANK = 15;

    private final int offset;
    private final String context;
    private final TokenKind expected;
    private final Token found;

    public ParseException(String message) {
        this(message, (TokenKind) null);
    }

    public ParseException(String message, TokenKind expected) {
        super(message);
        this.offset = -1;
        this.context = null;
        this.expected = expected;
        this.found = null;
    }

    public ParseException(String message, String source, int offset) {
        this(message, source, offset, null, null);
    }

    public ParseException(String message, String source, int offset, TokenKind expected, Token found) {
        super(message + "\nError context: \"... " + excerpt(source, offset) + " ...\"");
        this.offset = offset;
        this.context = excerpt(source, offset);
        this.expected = expected;
        this.found = found;
    }

    /** Offset of the failure in the source text, or -1 when the input ended early. */
    public int getOffset() {
        return offset;
    }

    /** Source text around the failure, the offending character between {@code >} and {@code <}. */
    public String getContext() {
        return context;
    }

    public TokenKind getExpected() {
        return expected;
    }

    public Token getFound() {
        return found;
    }

    static String excerpt(String source, int offset) {
        int start = Math.max(0, offset - CONTEXT_FLANK);
        int stop = Math.min(source.length(), offset + CONTEXT_FLANK);
        return StringUtils.substring(source, start, offset)
                + ">" + StringUtils.substring(source, offset, offset + 1) + "<"
                + StringUtils.substring(source, offset + 1, stop);
    }
}
