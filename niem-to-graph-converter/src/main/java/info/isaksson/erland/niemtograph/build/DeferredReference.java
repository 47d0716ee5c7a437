package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A reference edge whose target is declared in another document of a shared-namespace batch, if at all.
 */
public final class DeferredReference {
    public final GraphEdgeKind kind;
    public final String sourceNodeId;
    public final String rawId;
    public final String role;
    public final Map<String, Object> properties;
    public final String path;
    /** The referring element is {@code xsi:nil}. */
    public final boolean nil;

    public DeferredReference(GraphEdgeKind kind, String sourceNodeId, String rawId, String role,
                             Map<String, Object> properties, String path, boolean nil) {
        this.kind = kind;
        this.sourceNodeId = sourceNodeId;
        this.rawId = rawId;
        this.role = role;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.path = path;
        this.nil = nil;
    }
}
