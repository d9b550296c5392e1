package com.yongkangl.phylonet.io;

public enum TokenKind {
    OPEN_PAREN,
    CLOSE_PAREN,
    COLON,
    COMMA,
    SEMICOLON,
    OPEN_ANNOTATION,
    CLOSE_ANNOTATION,
    OPEN_VALUE_LIST,
    CLOSE_VALUE_LIST,
    EQUALS,
    HASH,
    STRING
}
