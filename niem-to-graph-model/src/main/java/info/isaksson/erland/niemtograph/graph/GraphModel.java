package info.isaksson.erland.niemtograph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The converter output: an ordered node sequence and an ordered edge sequence.
 *
 * <p>Order is creation order as produced by the converter; {@link GraphNormalizer} gives a canonical order.</p>
 */
@JsonPropertyOrder({"schemaVersion","sourceName","fingerprint","nodes","edges"})
public final class GraphModel {
    public static final String SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    /** Source document name (file name or caller supplied label); may be null. */
    public final String sourceName;
    /** Content fingerprint of the source document, or null for merged batch graphs. */
    public final String fingerprint;
    public final List<GraphNode> nodes;
    public final List<GraphEdge> edges;

    @JsonCreator
    public GraphModel(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("sourceName") String sourceName,
            @JsonProperty("fingerprint") String fingerprint,
            @JsonProperty("nodes") List<GraphNode> nodes,
            @JsonProperty("edges") List<GraphEdge> edges
    ) {
        this.schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        this.sourceName = sourceName;
        this.fingerprint = fingerprint;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public GraphModel(String sourceName, String fingerprint, List<GraphNode> nodes, List<GraphEdge> edges) {
        this(SCHEMA_VERSION, sourceName, fingerprint, nodes, edges);
    }

    public Optional<GraphNode> node(String id) {
        for (GraphNode n : nodes) {
            if (n.id.equals(id)) return Optional.of(n);
        }
        return Optional.empty();
    }

    public List<GraphNode> nodesOfType(String type) {
        List<GraphNode> out = new ArrayList<>();
        for (GraphNode n : nodes) {
            if (n.type.equals(type)) out.add(n);
        }
        return out;
    }

    public List<GraphEdge> edgesOfKind(GraphEdgeKind kind) {
        List<GraphEdge> out = new ArrayList<>();
        for (GraphEdge e : edges) {
            if (e.kind == kind) out.add(e);
        }
        return out;
    }

    public List<GraphEdge> outgoing(String nodeId) {
        List<GraphEdge> out = new ArrayList<>();
        for (GraphEdge e : edges) {
            if (e.sourceId.equals(nodeId)) out.add(e);
        }
        return out;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphModel)) return false;
        GraphModel that = (GraphModel) o;
        return Objects.equals(schemaVersion, that.schemaVersion) &&
                Objects.equals(sourceName, that.sourceName) &&
                Objects.equals(fingerprint, that.fingerprint) &&
                nodes.equals(that.nodes) &&
                edges.equals(that.edges);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, sourceName, fingerprint, nodes, edges);
    }
}
