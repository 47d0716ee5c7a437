package info.isaksson.erland.niemtograph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * A typed graph node.
 *
 * <p>Property values are scalars ({@link String}, {@link Number}, {@link Boolean}) or lists of
 * strings for repeated elements. Keys are kept sorted so serialized output is stable.</p>
 */
@JsonPropertyOrder({"id","type","flags","roleTypes","properties"})
public final class GraphNode {
    public final String id;
    public final String type;
    public final Map<String, Object> properties;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Set<NodeFlag> flags;

    /** Role qualified names aggregated by a hub; empty for every other node. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<String> roleTypes;

    @JsonCreator
    public GraphNode(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("properties") Map<String, Object> properties,
            @JsonProperty("flags") Set<NodeFlag> flags,
            @JsonProperty("roleTypes") List<String> roleTypes
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.properties = properties == null || properties.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(copyValues(properties)));
        this.flags = flags == null || flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        this.roleTypes = roleTypes == null ? List.of() : List.copyOf(roleTypes);
    }

    public GraphNode(String id, String type, Map<String, Object> properties) {
        this(id, type, properties, null, null);
    }

    @JsonIgnore
    public boolean isHub() {
        return flags.contains(NodeFlag.HUB);
    }

    @JsonIgnore
    public boolean isAssociation() {
        return flags.contains(NodeFlag.ASSOCIATION);
    }

    @JsonIgnore
    public boolean isAugmentationHost() {
        return flags.contains(NodeFlag.AUGMENTATION_HOST);
    }

    /** Property value as a string, or null when absent. Lists are rendered comma separated. */
    public String property(String key) {
        Object v = properties.get(key);
        if (v == null) return null;
        if (v instanceof List) {
            List<?> l = (List<?>) v;
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < l.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(l.get(i));
            }
            return sb.toString();
        }
        return String.valueOf(v);
    }

    private static Map<String, Object> copyValues(Map<String, Object> in) {
        Map<String, Object> out = new TreeMap<>();
        for (Map.Entry<String, Object> e : in.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            Object v = e.getValue();
            if (v instanceof List) {
                v = Collections.unmodifiableList(new ArrayList<>((List<?>) v));
            }
            out.put(e.getKey(), v);
        }
        return out;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphNode)) return false;
        GraphNode that = (GraphNode) o;
        return id.equals(that.id) &&
                type.equals(that.type) &&
                properties.equals(that.properties) &&
                flags.equals(that.flags) &&
                roleTypes.equals(that.roleTypes);
    }

    @Override public int hashCode() {
        return Objects.hash(id, type, properties, flags, roleTypes);
    }

    @Override public String toString() {
        return "GraphNode{" + id + " " + type + (flags.isEmpty() ? "" : " " + flags) + "}";
    }
}
