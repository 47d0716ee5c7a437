package info.isaksson.erland.niemtograph.graph;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Format-independent summaries of a graph.
 *
 * <p>Two graphs converted from the XML and the JSON encoding of one logical document must have equal
 * node signatures and equal edge-type counts. Ids are deliberately not part of either summary since
 * they embed the document fingerprint.</p>
 */
public final class GraphSignatures {

    private GraphSignatures() {}

    /**
     * Multiset of node signatures, rendered as {@code type[key1,key2,...]} with sorted keys, mapped to
     * the number of nodes sharing that signature.
     */
    public static Map<String, Integer> nodeSignatures(GraphModel model) {
        Map<String, Integer> out = new TreeMap<>();
        if (model == null) return out;
        for (GraphNode n : model.nodes) {
            out.merge(signature(n), 1, Integer::sum);
        }
        return out;
    }

    public static String signature(GraphNode node) {
        List<String> keys = new ArrayList<>(node.properties.keySet());
        keys.sort(String::compareTo);
        return node.type + "[" + String.join(",", keys) + "]";
    }

    public static Map<GraphEdgeKind, Integer> edgeTypeCounts(GraphModel model) {
        Map<GraphEdgeKind, Integer> out = new EnumMap<>(GraphEdgeKind.class);
        for (GraphEdgeKind k : GraphEdgeKind.values()) out.put(k, 0);
        if (model == null) return out;
        for (GraphEdge e : model.edges) {
            out.merge(e.kind, 1, Integer::sum);
        }
        return out;
    }
}
