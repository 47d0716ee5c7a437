package info.isaksson.erland.niemtograph.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Format-neutral element of a normalized exchange document.
 *
 * <p>Structural attributes (ids, references, nil, metadata references) are lifted out of
 * {@link #attributes} into dedicated fields when the node is built. Child order is document order.</p>
 */
public final class ElementNode {
    public final QualifiedName name;
    public final ElementKind kind;
    public final List<ElementNode> children;
    /** Trimmed scalar content of a simple element; null when empty or complex. */
    public final String text;
    /** Non-structural attributes in document order. */
    public final Map<QualifiedName, String> attributes;

    /** {@code structures:id} / JSON {@code @id} on a content-bearing object. */
    public final String declaredId;
    /** Raw ids this element points at ({@code structures:ref}, content-free {@code structures:uri}, JSON reference objects). */
    public final List<String> referenceTargets;
    /** Identity this element plays a role for ({@code structures:uri} on a content-bearing element). */
    public final String roleOf;
    public final boolean nil;
    /** Metadata reference attribute to referenced raw ids. */
    public final Map<QualifiedName, List<String>> metadataRefs;

    private ElementNode(Builder b) {
        this.name = b.name;
        this.children = List.copyOf(b.children);
        this.kind = b.kindOverride != null ? b.kindOverride
                : (children.isEmpty() ? ElementKind.SIMPLE : ElementKind.COMPLEX);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.declaredId = b.declaredId;
        this.nil = b.nil;

        Map<QualifiedName, List<String>> meta = new LinkedHashMap<>();
        b.metadataRefs.forEach((k, v) -> meta.put(k, List.copyOf(v)));
        this.metadataRefs = Collections.unmodifiableMap(meta);

        String t = b.text == null ? null : b.text.trim();
        this.text = (t == null || t.isEmpty() || !children.isEmpty()) ? null : t;

        List<String> refs = new ArrayList<>(b.referenceTargets);
        String role = null;
        if (b.uri != null) {
            // A uri on an element without content is a plain reference; with content it is a role claim.
            if (children.isEmpty() && this.text == null) {
                refs.add(b.uri);
            } else {
                role = b.uri;
            }
        }
        this.referenceTargets = List.copyOf(refs);
        this.roleOf = role;
    }

    public static Builder builder(QualifiedName name) {
        return new Builder(name);
    }

    public boolean isComplex() {
        return kind == ElementKind.COMPLEX;
    }

    public boolean hasReference() {
        return !referenceTargets.isEmpty();
    }

    public boolean hasMetadataRefs() {
        return !metadataRefs.isEmpty();
    }

    /** Attributes as {@link ElementKind#ATTRIBUTE_LIKE} leaf nodes, in document order. */
    public List<ElementNode> attributeNodes() {
        if (attributes.isEmpty()) return List.of();
        List<ElementNode> out = new ArrayList<>(attributes.size());
        for (Map.Entry<QualifiedName, String> a : attributes.entrySet()) {
            Builder b = new Builder(a.getKey());
            b.kindOverride = ElementKind.ATTRIBUTE_LIKE;
            b.text = a.getValue();
            out.add(b.build());
        }
        return out;
    }

    @Override public String toString() {
        return "ElementNode{" + name + " " + kind
                + (declaredId == null ? "" : " id=" + declaredId)
                + (referenceTargets.isEmpty() ? "" : " ref=" + referenceTargets)
                + (roleOf == null ? "" : " roleOf=" + roleOf)
                + "}";
    }

    public static final class Builder {
        private final QualifiedName name;
        private final List<ElementNode> children = new ArrayList<>();
        private final Map<QualifiedName, String> attributes = new LinkedHashMap<>();
        private final List<String> referenceTargets = new ArrayList<>();
        private final Map<QualifiedName, List<String>> metadataRefs = new LinkedHashMap<>();
        private ElementKind kindOverride;
        private String text;
        private String declaredId;
        private String uri;
        private boolean nil;

        private Builder(QualifiedName name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder child(ElementNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder declaredId(String id) {
            this.declaredId = id == null || id.isBlank() ? null : id.trim();
            return this;
        }

        public Builder reference(String rawId) {
            String s = StructuralAttributes.stripFragment(rawId);
            if (s != null && !s.isEmpty()) referenceTargets.add(s);
            return this;
        }

        public Builder uri(String uriValue) {
            String s = StructuralAttributes.stripFragment(uriValue);
            this.uri = s == null || s.isEmpty() ? null : s;
            return this;
        }

        public Builder nil(boolean nil) {
            this.nil = nil;
            return this;
        }

        /**
         * Add an attribute as written in the source. Structural attributes are routed to their dedicated
         * fields; everything else is kept as a plain attribute.
         */
        public Builder attribute(QualifiedName attrName, String value) {
            Objects.requireNonNull(attrName, "attrName");
            if (value == null) return this;
            if (StructuralAttributes.isMetadataReference(attrName)) {
                List<String> ids = StructuralAttributes.splitIdList(value);
                if (!ids.isEmpty()) metadataRefs.computeIfAbsent(attrName, k -> new ArrayList<>()).addAll(ids);
                return this;
            }
            if (StructuralAttributes.isStructures(attrName)) {
                switch (attrName.localName) {
                    case "id":
                        return declaredId(value);
                    case "ref":
                        for (String id : StructuralAttributes.splitIdList(value)) reference(id);
                        return this;
                    case "uri":
                        return uri(value);
                    default:
                        // sequenceID and friends carry no graph meaning
                        return this;
                }
            }
            if (StructuralAttributes.isXsi(attrName)) {
                if (attrName.localName.equals("nil")) nil = StructuralAttributes.isTrue(value);
                return this;
            }
            attributes.put(attrName, value);
            return this;
        }

        public ElementNode build() {
            return new ElementNode(this);
        }
    }
}
