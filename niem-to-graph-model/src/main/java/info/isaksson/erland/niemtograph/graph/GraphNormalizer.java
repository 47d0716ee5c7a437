package info.isaksson.erland.niemtograph.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Produces a stable, deterministic ordering of nodes and edges so JSON output is reproducible.
 *
 * <p>Nodes are ordered by (id), edges by (kind, sourceId, targetId, id). Property maps are already
 * key-sorted by {@link GraphNode} and {@link GraphEdge}.</p>
 */
public final class GraphNormalizer {

    private GraphNormalizer() {}

    public static GraphModel normalize(GraphModel in) {
        if (in == null) return null;
        return new GraphModel(in.schemaVersion, in.sourceName, in.fingerprint, normalizeNodes(in.nodes), normalizeEdges(in.edges));
    }

    static List<GraphNode> normalizeNodes(List<GraphNode> in) {
        if (in == null) return List.of();
        List<GraphNode> out = new ArrayList<>(in.size());
        for (GraphNode n : in) {
            if (n == null) continue;
            out.add(n);
        }
        out.sort(Comparator
                .comparing((GraphNode n) -> n.id)
                .thenComparing(n -> n.type));
        return List.copyOf(out);
    }

    static List<GraphEdge> normalizeEdges(List<GraphEdge> in) {
        if (in == null) return List.of();
        List<GraphEdge> out = new ArrayList<>(in.size());
        for (GraphEdge e : in) {
            if (e == null) continue;
            out.add(e);
        }
        out.sort(Comparator
                .comparing((GraphEdge e) -> e.kind.name())
                .thenComparing(e -> e.sourceId)
                .thenComparing(e -> e.targetId)
                .thenComparing(e -> e.id));
        return List.copyOf(out);
    }
}
