package info.isaksson.erland.niemtograph.resolve;

import info.isaksson.erland.niemtograph.build.ElementShape;
import info.isaksson.erland.niemtograph.document.ElementNode;
import info.isaksson.erland.niemtograph.mapping.TypeRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolver view of one element: its path, shape, ids and resolved references.
 *
 * <p>Created and completed by {@link IdentifierResolver}; read-only for later phases.</p>
 */
public final class ElementInfo {
    public final ElementNode element;
    public final ElementInfo parent;
    /** Position among the parent's element children, 0-based. */
    public final int ordinal;
    /** Pre-order position in the document. */
    public final int order;
    /** Slash separated path with 1-based indexes on repeated sibling names. */
    public final String path;
    public final ElementShape shape;
    /** Mapping rule that decided the shape; null in dynamic mode or without an entry. */
    public final TypeRule rule;
    /** Stable key of the element; equals the node id for node-bearing shapes. */
    final String key;

    String nodeId;
    String ownerNodeId;
    final List<ElementInfo> children = new ArrayList<>();
    final List<ResolvedReference> references = new ArrayList<>();

    ElementInfo(ElementNode element, ElementInfo parent, int ordinal, int order, String path,
                ElementShape shape, TypeRule rule, String key) {
        this.element = element;
        this.parent = parent;
        this.ordinal = ordinal;
        this.order = order;
        this.path = path;
        this.shape = shape;
        this.rule = rule;
        this.key = key;
    }

    /** Node id for {@code COMPLEX_ENTITY} and {@code ASSOCIATION} shapes, otherwise null. */
    public String nodeId() {
        return nodeId;
    }

    /** Id of the nearest ancestor node; null for the root. */
    public String ownerNodeId() {
        return ownerNodeId;
    }

    public List<ElementInfo> children() {
        return Collections.unmodifiableList(children);
    }

    /** Reference targets of a reference-only element, in attribute order. */
    public List<ResolvedReference> references() {
        return Collections.unmodifiableList(references);
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Node type: the mapping label when one is configured, else the prefixed qualified name. */
    public String nodeType() {
        if (rule != null && rule.label != null) return rule.label;
        return element.name.prefixed();
    }

    public String qname() {
        return element.name.prefixed();
    }

    @Override public String toString() {
        return "ElementInfo{" + path + " " + shape + (nodeId == null ? "" : " " + nodeId) + "}";
    }
}
