package com.yongkangl.phylonet.io;

import com.yongkangl.phylonet.tree.Node;
import com.yongkangl.phylonet.tree.Tree;
import org.apache.commons.lang3.StringUtils;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes trees as extended Newick, including hybrid markers and {@code [&key=value]} annotations.
 */
public class NewickWriter {
    private static final String LABEL_SPECIALS = ",():;[]#'\"{}=";
    private static final String VALUE_SPECIALS = ",[]{}=#'\"";

    private NewickWriter() {
    }

    /** The root branch length is written as {@code 0.0} when undefined. */
    public static String write(Tree tree) {
        StringBuilder sb = new StringBuilder();
        writeNode(tree.getRoot(), sb);
        sb.append(":");
        Double rootLength = tree.getRoot().getBranchLength();
        sb.append(rootLength == null ? "0.0" : formatNumber(rootLength));
        sb.append(";");
        return sb.toString();
    }

    private static void writeNode(Node node, StringBuilder sb) {
        if (!node.isLeaf()) {
            sb.append("(");
            for (int i = 0; i < node.getChildCount(); i++) {
                if (i > 0) sb.append(",");
                Node child = node.getChild(i);
                writeNode(child, sb);
                if (child.getBranchLength() != null) {
                    sb.append(":").append(formatNumber(child.getBranchLength()));
                }
            }
            sb.append(")");
        }
        if (node.getLabel() != null && !node.getLabel().isEmpty()) {
            sb.append(quote(node.getLabel(), LABEL_SPECIALS));
        }
        if (node.isHybrid()) {
            sb.append("#");
            if (node.getHybridType() != null) {
                sb.append(node.getHybridType());
            }
            sb.append(node.getHybridID());
        }
        if (!node.getAnnotation().isEmpty()) {
            sb.append("[&");
            Iterator<Map.Entry<String, Object>> entries = node.getAnnotation().entrySet().iterator();
            while (entries.hasNext()) {
                Map.Entry<String, Object> entry = entries.next();
                sb.append(quote(entry.getKey(), VALUE_SPECIALS)).append("=");
                writeValue(entry.getValue(), sb);
                if (entries.hasNext()) sb.append(",");
            }
            sb.append("]");
        }
    }

    private static void writeValue(Object value, StringBuilder sb) {
        if (value instanceof List) {
            sb.append("{");
            List<?> values = (List<?>) value;
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(",");
                writeValue(values.get(i), sb);
            }
            sb.append("}");
        } else if (value != null) {
            sb.append(quote(value.toString(), VALUE_SPECIALS));
        }
    }

    static String quote(String text, String specials) {
        boolean needsQuotes = StringUtils.containsAny(text, specials)
                || StringUtils.containsWhitespace(text);
        if (!needsQuotes || text.isEmpty()) {
            return text;
        }
        return "'" + text.replace("'", "''") + "'";
    }

    /** Integral values are written without a fractional part. */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
