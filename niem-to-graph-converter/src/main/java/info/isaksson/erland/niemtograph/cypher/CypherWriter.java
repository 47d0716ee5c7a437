package info.isaksson.erland.niemtograph.cypher;

import info.isaksson.erland.niemtograph.graph.GraphEdge;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.graph.GraphNode;
import info.isaksson.erland.niemtograph.graph.GraphNormalizer;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders a graph as idempotent Cypher {@code MERGE} statements, one per line.
 *
 * <p>Nodes are merged on {@code id} under a label derived from their type ({@code nc:Person} becomes
 * {@code nc_Person}); edges are merged between matched endpoints. Output order is the normalized graph
 * order, so the same graph always renders the same script.</p>
 */
public final class CypherWriter {

    private static final Pattern SAFE_NAME = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private CypherWriter() {}

    public static String render(GraphModel model) {
        StringBuilder sb = new StringBuilder();
        try {
            write(model, sb);
        } catch (IOException e) {
            // StringBuilder does not throw
            throw new IllegalStateException(e);
        }
        return sb.toString();
    }

    public static void write(GraphModel model, Path file) throws IOException {
        Path parent = file.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(model, w);
        }
    }

    public static void write(GraphModel model, Appendable out) throws IOException {
        GraphModel g = GraphNormalizer.normalize(model);
        String source = g.sourceName == null ? "" : g.sourceName;
        out.append("// ").append(String.valueOf(g.nodes.size())).append(" nodes, ")
                .append(String.valueOf(g.edges.size())).append(" edges from ").append(source).append('\n');

        Map<String, String> labels = new HashMap<>();
        for (GraphNode n : g.nodes) {
            String label = label(n.type);
            labels.put(n.id, label);
            out.append("MERGE (n:").append(quoteName(label)).append(" {id:").append(literal(n.id)).append("})");
            out.append(" ON CREATE SET n.qname=").append(literal(n.type));
            out.append(", n.sourceDoc=").append(literal(source));
            if (!n.flags.isEmpty()) {
                out.append(", n.flags=").append(list(n.flags.stream().map(Enum::name).toArray()));
            }
            if (!n.roleTypes.isEmpty()) {
                out.append(", n.roleTypes=").append(list(n.roleTypes.toArray()));
            }
            for (Map.Entry<String, Object> p : n.properties.entrySet()) {
                out.append(", n.").append(propertyName(p.getKey())).append('=').append(value(p.getValue()));
            }
            out.append(";\n");
        }

        for (GraphEdge e : g.edges) {
            out.append("MATCH (a:").append(quoteName(labels.get(e.sourceId))).append(" {id:").append(literal(e.sourceId)).append("}), ");
            out.append("(b:").append(quoteName(labels.get(e.targetId))).append(" {id:").append(literal(e.targetId)).append("}) ");
            out.append("MERGE (a)-[r:").append(quoteName(e.kind.name())).append(" {id:").append(literal(e.id)).append("}]->(b)");
            if (!e.properties.isEmpty()) {
                out.append(" ON CREATE SET ");
                boolean first = true;
                for (Map.Entry<String, Object> p : e.properties.entrySet()) {
                    if (!first) out.append(", ");
                    first = false;
                    out.append("r.").append(propertyName(p.getKey())).append('=').append(value(p.getValue()));
                }
            }
            out.append(";\n");
        }
    }

    /** {@code nc:Person} to {@code nc_Person}; characters outside [A-Za-z0-9_] become underscores. */
    static String label(String type) {
        String s = type.replaceAll("[^A-Za-z0-9_]", "_");
        return s.isEmpty() ? "_" : s;
    }

    static String propertyName(String key) {
        return SAFE_NAME.matcher(key).matches() ? key : quoteName(key);
    }

    static String quoteName(String name) {
        return "`" + name.replace("`", "``") + "`";
    }

    static String literal(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    static String value(Object v) {
        if (v instanceof Boolean) return v.toString();
        if (v instanceof BigDecimal) return ((BigDecimal) v).toPlainString();
        if (v instanceof Number) return v.toString();
        if (v instanceof List) return list(((List<?>) v).toArray());
        return literal(String.valueOf(v));
    }

    private static String list(Object[] items) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < items.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(value(items[i]));
        }
        return sb.append(']').toString();
    }
}
