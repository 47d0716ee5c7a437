package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.graph.GraphNode;
import info.isaksson.erland.niemtograph.graph.NodeFlag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/** Mutable node under construction; frozen into a {@link GraphNode} when the conversion completes. */
public final class NodeDraft {
    public final String id;
    private String type;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Set<NodeFlag> flags = EnumSet.noneOf(NodeFlag.class);
    private final Set<String> roleTypes = new TreeSet<>();

    public NodeDraft(String id, String type) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String type() {
        return type;
    }

    public void type(String type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    /**
     * Sets a property; a second value for the same key turns the property into a list, in call order.
     */
    @SuppressWarnings("unchecked")
    public void addProperty(String key, Object value) {
        if (key == null || value == null) return;
        Object existing = properties.get(key);
        if (existing == null) {
            properties.put(key, value);
        } else if (existing instanceof List) {
            ((List<Object>) existing).add(value);
        } else {
            List<Object> list = new ArrayList<>();
            list.add(existing);
            list.add(value);
            properties.put(key, list);
        }
    }

    /** Sets a property only when the key is not present yet. */
    public boolean putIfAbsent(String key, Object value) {
        if (key == null || value == null || properties.containsKey(key)) return false;
        properties.put(key, value instanceof List ? new ArrayList<>((List<?>) value) : value);
        return true;
    }

    public void putProperty(String key, Object value) {
        if (key == null || value == null) return;
        properties.put(key, value);
    }

    public Map<String, Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public void addFlag(NodeFlag flag) {
        flags.add(flag);
    }

    public void removeFlag(NodeFlag flag) {
        flags.remove(flag);
    }

    public boolean hasFlag(NodeFlag flag) {
        return flags.contains(flag);
    }

    public void addRoleType(String roleType) {
        roleTypes.add(roleType);
    }

    /** Folds another draft for the same id into this one; values already present win. */
    void absorb(NodeDraft other) {
        for (Map.Entry<String, Object> e : other.properties.entrySet()) {
            putIfAbsent(e.getKey(), e.getValue());
        }
        flags.addAll(other.flags);
        roleTypes.addAll(other.roleTypes);
    }

    public GraphNode freeze() {
        return new GraphNode(id, type, properties, flags, new ArrayList<>(roleTypes));
    }

    @Override public String toString() {
        return "NodeDraft{" + id + " " + type + "}";
    }
}
