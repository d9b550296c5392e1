package com.yongkangl.phylonet.io;

import com.yongkangl.phylonet.tree.Node;
import com.yongkangl.phylonet.tree.Tree;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code TREES} blocks of a Nexus file. Other blocks are ignored.
 */
public class NexusReader {
    private static final Logger LOG = Logger.getLogger(NexusReader.class);

    private static final Pattern COMMENT = Pattern.compile("\\[(?!&)[^\\]]*\\]");
    private static final Pattern TREES_BLOCK =
            Pattern.compile("begin\\s+trees\\s*;(.*?)\\bend(?:block)?\\s*;", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private NexusReader() {
    }

    /**
     * @throws TreeFormatException if the text holds no trees block or a tree statement is malformed
     */
    public static List<Tree> readTreesFromNexus(String nexus) {
        String text = COMMENT.matcher(nexus).replaceAll("");
        Matcher block = TREES_BLOCK.matcher(text);
        List<Tree> trees = new ArrayList<>();
        boolean found = false;
        while (block.find()) {
            found = true;
            readTreesBlock(block.group(1), trees);
        }
        if (!found) {
            throw new TreeFormatException("No trees block found in Nexus file.");
        }
        return trees;
    }

    private static void readTreesBlock(String block, List<Tree> trees) {
        NewickReader newickReader = new NewickReader(true);
        Map<String, String> translation = new HashMap<>();

        for (String statement : splitStatements(block)) {
            String keyword = StringUtils.substringBefore(statement, " ").toLowerCase();
            String body = StringUtils.substringAfter(statement, " ").trim();
            switch (keyword) {
                case "translate":
                    for (Pair<String, String> entry : parseTranslation(body)) {
                        translation.put(entry.getKey(), entry.getValue());
                    }
                    break;
                case "tree":
                case "utree": {
                    int equals = indexOfTopLevel(body, '=');
                    if (equals < 0) {
                        throw new TreeFormatException("Malformed tree statement: " + StringUtils.abbreviate(statement, 60));
                    }
                    String name = StringUtils.removeStart(body.substring(0, equals).trim(), "*").trim();
                    if (keyword.equals("utree")) {
                        LOG.warn("Skipping Nexus tree: Unrooted tree " + name + ".");
                        break;
                    }
                    try {
                        Tree tree = newickReader.read(body.substring(equals + 1).trim() + ";");
                        translate(tree, translation);
                        trees.add(tree);
                    } catch (SkipTreeException e) {
                        LOG.warn("Skipping Nexus tree: " + e.getMessage());
                    }
                    break;
                }
                default:
                    break;
            }
        }
    }

    private static void translate(Tree tree, Map<String, String> translation) {
        if (translation.isEmpty()) {
            return;
        }
        for (Node leaf : tree.getLeafList()) {
            String label = translation.get(leaf.getLabel());
            if (label != null) {
                leaf.setLabel(label);
            }
        }
        tree.clearCaches();
    }

    static List<Pair<String, String>> parseTranslation(String body) {
        List<Pair<String, String>> entries = new ArrayList<>();
        for (String entry : body.split(",")) {
            String[] parts = entry.trim().split("\\s+", 2);
            if (parts.length < 2) {
                if (!parts[0].isEmpty()) {
                    throw new TreeFormatException("Malformed translate entry: " + entry.trim());
                }
                continue;
            }
            entries.add(Pair.of(parts[0], unquote(parts[1].trim())));
        }
        return entries;
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            return text.substring(1, text.length() - 1).replace("''", "'");
        }
        return text;
    }

    /** Splits on semicolons outside quotes and square brackets. */
    static List<String> splitStatements(String block) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int depth = 0;
        for (char c : block.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '[') {
                depth++;
            } else if (!quoted && c == ']') {
                depth--;
            } else if (!quoted && depth == 0 && c == ';') {
                addStatement(statements, current);
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        addStatement(statements, current);
        return statements;
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim().replaceAll("\\s+", " ");
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    private static int indexOfTopLevel(String text, char target) {
        boolean quoted = false;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '[') {
                depth++;
            } else if (!quoted && c == ']') {
                depth--;
            } else if (!quoted && depth == 0 && c == target) {
                return i;
            }
        }
        return -1;
    }
}
