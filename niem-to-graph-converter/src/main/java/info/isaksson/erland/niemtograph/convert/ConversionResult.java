package info.isaksson.erland.niemtograph.convert;

import info.isaksson.erland.niemtograph.graph.GraphEdge;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.graph.GraphNode;

import java.util.List;
import java.util.Objects;

/** Converted graph plus the warnings collected while building it. */
public final class ConversionResult {
    public final GraphModel graph;
    public final List<ConversionWarning> warnings;

    public ConversionResult(GraphModel graph, List<ConversionWarning> warnings) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<GraphNode> nodes() {
        return graph.nodes;
    }

    public List<GraphEdge> edges() {
        return graph.edges;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
