package com.yongkangl.phylonet.io;

import com.yongkangl.phylonet.tree.Node;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for a single extended Newick tree. Node ids follow pre-order.
 */
public class NewickParser {
    private static final Logger LOG = Logger.getLogger(NewickParser.class);
    private static final Pattern HYBRID_PATTERN = Pattern.compile("([A-Za-z]*)(-?\\d+)");

    private final String input;
    private List<Token> tokens;
    private int position;
    private int nextNodeID;
    private Boolean rooted;

    public NewickParser(String input) {
        this.input = input;
    }

    /**
     * @throws LexException   if the text contains a character no token starts with
     * @throws ParseException if the tokens do not form a tree
     */
    public Node parse() {
        tokens = new NewickLexer(input).tokenize();
        position = 0;
        nextNodeID = 0;
        rooted = null;

        parseRootingComment();
        Node root = parseNode(null);

        if (!accept(TokenKind.SEMICOLON, false) && accept(TokenKind.COMMA, false)) {
            throw new ParseException("Tree/network with multiple roots found.", input,
                    tokens.get(position - 1).getOffset());
        }
        if (position < tokens.size()) {
            LOG.warn("Ignoring " + (tokens.size() - position) + " token(s) after the end of the tree at position "
                    + tokens.get(position).getOffset());
        }
        return root;
    }

    /**
     * {@code TRUE} for a leading {@code [&R]}, {@code FALSE} for {@code [&U]}, {@code null} when the
     * tree carries no rooting comment.
     */
    public Boolean getRooted() {
        return rooted;
    }

    private void parseRootingComment() {
        if (tokens.size() >= 3
                && tokens.get(0).getKind() == TokenKind.OPEN_ANNOTATION
                && tokens.get(1).getKind() == TokenKind.STRING
                && tokens.get(2).getKind() == TokenKind.CLOSE_ANNOTATION) {
            String flag = tokens.get(1).getText();
            if (flag.equalsIgnoreCase("R") || flag.equalsIgnoreCase("U")) {
                rooted = flag.equalsIgnoreCase("R");
                position = 3;
            }
        }
    }

    private boolean accept(TokenKind kind, boolean mandatory) {
        if (position < tokens.size() && tokens.get(position).getKind() == kind) {
            position++;
            return true;
        }
        if (!mandatory) {
            return false;
        }
        if (position < tokens.size()) {
            Token found = tokens.get(position);
            throw new ParseException("Expected token " + kind + " but found " + found.getKind()
                    + " (" + found.getText() + ") at string position " + found.getOffset() + ".",
                    input, found.getOffset(), kind, found);
        }
        throw new ParseException("Newick string terminated early. Expected token " + kind + ".", kind);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }

    private Node parseNode(Node parent) {
        Node node = new Node(nextNodeID++);
        if (parent != null) {
            parent.addChild(node);
        }

        parseChildren(node);
        parseLabel(node);
        parseHybrid(node);
        parseAnnotation(node);
        parseBranchLength(node);

        return node;
    }

    private void parseChildren(Node node) {
        if (accept(TokenKind.OPEN_PAREN, false)) {
            parseNode(node);
            while (accept(TokenKind.COMMA, false)) {
                parseNode(node);
            }
            accept(TokenKind.CLOSE_PAREN, true);
        }
    }

    private void parseLabel(Node node) {
        if (accept(TokenKind.STRING, false)) {
            node.setLabel(previous().getText());
        }
    }

    private void parseHybrid(Node node) {
        if (accept(TokenKind.HASH, false)) {
            accept(TokenKind.STRING, true);
            Token token = previous();
            Matcher matcher = HYBRID_PATTERN.matcher(token.getText());
            if (!matcher.matches()) {
                throw new ParseException("Expected integer hybrid id. Found " + token.getText() + " instead.",
                        input, token.getOffset());
            }
            try {
                node.setHybridID(Integer.parseInt(matcher.group(2)));
            } catch (NumberFormatException e) {
                throw new ParseException("Hybrid id out of range: " + token.getText(), input, token.getOffset());
            }
            if (!matcher.group(1).isEmpty()) {
                node.setHybridType(matcher.group(1));
            }
        }
    }

    private void parseAnnotation(Node node) {
        if (accept(TokenKind.OPEN_ANNOTATION, false)) {
            parseAnnotationEntry(node);
            while (accept(TokenKind.COMMA, false)) {
                parseAnnotationEntry(node);
            }
            accept(TokenKind.CLOSE_ANNOTATION, true);
        }
    }

    private void parseAnnotationEntry(Node node) {
        accept(TokenKind.STRING, true);
        String key = previous().getText();
        accept(TokenKind.EQUALS, true);
        node.getAnnotation().put(key, parseValue());
    }

    private Object parseValue() {
        if (accept(TokenKind.STRING, false)) {
            return previous().getText();
        }
        if (accept(TokenKind.OPEN_VALUE_LIST, false)) {
            List<Object> values = new ArrayList<>();
            values.add(parseValue());
            while (accept(TokenKind.COMMA, false)) {
                values.add(parseValue());
            }
            accept(TokenKind.CLOSE_VALUE_LIST, true);
            return values;
        }
        return null;
    }

    private void parseBranchLength(Node node) {
        if (accept(TokenKind.COLON, false)) {
            accept(TokenKind.STRING, true);
            Token token = previous();
            double length;
            try {
                length = Double.parseDouble(token.getText());
            } catch (NumberFormatException e) {
                length = Double.NaN;
            }
            if (Double.isNaN(length)) {
                throw new ParseException("Expected numerical branch length. Found " + token.getText() + " instead.",
                        input, token.getOffset());
            }
            node.setBranchLength(length);

            // support values and the like, e.g. A:0.1:95
            while (accept(TokenKind.COLON, false)) {
                accept(TokenKind.STRING, false);
            }

            parseAnnotation(node);
        }
    }
}
