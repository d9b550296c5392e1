package com.yongkangl.phylonet.io;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits extended Newick text into tokens.
 *
 * <p>The lexer switches to annotation mode after {@code [&} and back after {@code ]}. Bare strings
 * may contain {@code {}=} outside annotations and {@code ():;#} inside them. At each position the
 * longest matching rule wins, ties going to the rule listed first. Trailing whitespace of unquoted
 * strings is dropped.
 */
public class NewickLexer {
    private enum Mode { DEFAULT, ANNOTATION }

    private static final class Rule {
        final TokenKind kind;
        final Pattern pattern;
        final char quote;
        final Mode mode;

        Rule(TokenKind kind, String regex, char quote, Mode mode) {
            this.kind = kind;
            this.pattern = Pattern.compile(regex);
            this.quote = quote;
            this.mode = mode;
        }

        boolean appliesTo(Mode current) {
            return mode == null || mode == current;
        }
    }

    private static final char NO_QUOTE = 0;

    private static final Rule[] RULES = {
            new Rule(TokenKind.OPEN_PAREN, "\\(", NO_QUOTE, null),
            new Rule(TokenKind.CLOSE_PAREN, "\\)", NO_QUOTE, null),
            new Rule(TokenKind.COLON, ":", NO_QUOTE, null),
            new Rule(TokenKind.COMMA, ",", NO_QUOTE, null),
            new Rule(TokenKind.SEMICOLON, ";", NO_QUOTE, null),
            new Rule(TokenKind.OPEN_ANNOTATION, "\\[&", NO_QUOTE, null),
            new Rule(TokenKind.CLOSE_ANNOTATION, "\\]", NO_QUOTE, null),
            new Rule(TokenKind.OPEN_VALUE_LIST, "\\{", NO_QUOTE, null),
            new Rule(TokenKind.CLOSE_VALUE_LIST, "\\}", NO_QUOTE, null),
            new Rule(TokenKind.EQUALS, "=", NO_QUOTE, null),
            new Rule(TokenKind.HASH, "#", NO_QUOTE, null),
            // quoted strings stay possessive: a plain alternation recurses once per character
            new Rule(TokenKind.STRING, "\"(?:[^\"]++|\"\")++\"", '"', null),
            new Rule(TokenKind.STRING, "'(?:[^']++|'')++'", '\'', null),
            new Rule(TokenKind.STRING, "[^,():;\\[\\]#]+(?:\\([^)]*\\))?", NO_QUOTE, Mode.DEFAULT),
            new Rule(TokenKind.STRING, "[^,\\[\\]{}=]+", NO_QUOTE, Mode.ANNOTATION),
    };

    private final String input;

    public NewickLexer(String input) {
        this.input = input;
    }

    /**
     * @throws LexException if a character starts no token in the current mode
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Mode mode = Mode.DEFAULT;
        Matcher[] matchers = new Matcher[RULES.length];
        for (int k = 0; k < RULES.length; k++) {
            matchers[k] = RULES[k].pattern.matcher(input);
        }

        int position = 0;
        while (position < input.length()) {
            if (Character.isWhitespace(input.charAt(position))) {
                position++;
                continue;
            }

            int best = -1;
            int bestLength = 0;
            for (int k = 0; k < RULES.length; k++) {
                if (!RULES[k].appliesTo(mode)) {
                    continue;
                }
                Matcher matcher = matchers[k];
                matcher.region(position, input.length());
                if (matcher.lookingAt() && matcher.end() - position > bestLength) {
                    best = k;
                    bestLength = matcher.end() - position;
                }
            }
            if (best < 0) {
                throw new LexException(input.charAt(position), position);
            }

            Rule rule = RULES[best];
            String text = input.substring(position, position + bestLength);
            if (rule.quote != NO_QUOTE) {
                String quote = String.valueOf(rule.quote);
                text = text.substring(1, text.length() - 1).replace(quote + quote, quote);
            } else if (rule.kind == TokenKind.STRING) {
                text = StringUtils.stripEnd(text, null);
            }
            tokens.add(new Token(rule.kind, text, position));

            if (rule.kind == TokenKind.OPEN_ANNOTATION) {
                mode = Mode.ANNOTATION;
            } else if (rule.kind == TokenKind.CLOSE_ANNOTATION) {
                mode = Mode.DEFAULT;
            }
            position += bestLength;
        }
        return tokens;
    }
}
