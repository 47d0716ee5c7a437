package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.graph.GraphEdge;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Edge under construction. Only the overlay adds properties after creation. */
public final class EdgeDraft {
    public final String id;
    public final GraphEdgeKind kind;
    public final String sourceId;
    public final String targetId;
    public final String discriminator;
    private final Map<String, Object> properties = new LinkedHashMap<>();

    EdgeDraft(String id, GraphEdgeKind kind, String sourceId, String targetId, String discriminator) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.discriminator = discriminator;
    }

    public void putProperty(String key, Object value) {
        if (key == null || value == null) return;
        properties.put(key, value);
    }

    public boolean putIfAbsent(String key, Object value) {
        if (key == null || value == null || properties.containsKey(key)) return false;
        properties.put(key, value);
        return true;
    }

    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public GraphEdge freeze() {
        return new GraphEdge(id, kind, sourceId, targetId, properties);
    }

    @Override public String toString() {
        return "EdgeDraft{" + kind + " " + sourceId + " -> " + targetId + "}";
    }
}
