package info.isaksson.erland.niemtograph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

@JsonPropertyOrder({"id","kind","sourceId","targetId","properties"})
public final class GraphEdge {
    public final String id;
    public final GraphEdgeKind kind;
    public final String sourceId;
    public final String targetId;
    public final Map<String, Object> properties;

    @JsonCreator
    public GraphEdge(
            @JsonProperty("id") String id,
            @JsonProperty("kind") GraphEdgeKind kind,
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("targetId") String targetId,
            @JsonProperty("properties") Map<String, Object> properties
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.properties = properties == null || properties.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(properties));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphEdge)) return false;
        GraphEdge that = (GraphEdge) o;
        return id.equals(that.id) &&
                kind == that.kind &&
                sourceId.equals(that.sourceId) &&
                targetId.equals(that.targetId) &&
                properties.equals(that.properties);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, sourceId, targetId, properties);
    }

    @Override public String toString() {
        return "GraphEdge{" + kind + " " + sourceId + " -> " + targetId + "}";
    }
}
