package com.jpexs.flowchart;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes a {@link GraphDescription} in the Graphviz DOT language.
 * One declaration per node, one per edge, attributes in a fixed order so the
 * output of equal graphs is byte-identical.
 *
 * @author JPEXS
 */
public class DotDialect {

    public static final DotDialect INSTANCE = new DotDialect();

    private static final String INDENT = "    ";

    private DotDialect() {

    }

    /**
     * Generates the DOT source of a graph.
     *
     * @param graph the graph
     * @return DOT source
     */
    public String toDot(GraphDescription graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph {\n");

        Map<String, String> graphAttributes = new LinkedHashMap<>();
        graphAttributes.put("rankdir", graph.getDirection().getRankdir());
        graphAttributes.put("label", graph.getTitle());
        graphAttributes.put("labelloc", "t");
        graphAttributes.put("fontsize", "20");
        for (Map.Entry<String, String> entry : graphAttributes.entrySet()) {
            sb.append(INDENT).append(entry.getKey()).append('=').append(quote(entry.getValue())).append(";\n");
        }

        for (Node node : graph.getNodes()) {
            sb.append(INDENT).append(node.getName()).append(' ');
            appendAttributes(sb, getNodeAttributes(node));
            sb.append(";\n");
        }

        for (Edge edge : graph.getEdges()) {
            sb.append(INDENT).append('n').append(edge.getFrom()).append(" -> n").append(edge.getTo());
            if (edge.hasLabel()) {
                Map<String, String> attributes = new LinkedHashMap<>();
                attributes.put("label", edge.getLabel());
                sb.append(' ');
                appendAttributes(sb, attributes);
            }
            sb.append(";\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    private Map<String, String> getNodeAttributes(Node node) {
        Map<String, String> ret = new LinkedHashMap<>();
        ret.put("label", node.getLabel());
        ret.put("shape", node.getShape());
        ret.put("style", "filled");
        ret.put("fillcolor", node.getFillColor());
        return ret;
    }

    private void appendAttributes(StringBuilder sb, Map<String, String> attributes) {
        sb.append('[');
        boolean first = true;
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            if (!first) {
                sb.append(' ');
            }
            first = false;
            sb.append(entry.getKey()).append('=').append(quote(entry.getValue()));
        }
        sb.append(']');
    }

    /**
     * Quotes a string as a DOT double-quoted ID.
     *
     * @param value the raw value
     * @return the quoted value
     */
    public String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
