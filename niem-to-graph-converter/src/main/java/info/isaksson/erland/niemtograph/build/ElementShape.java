package info.isaksson.erland.niemtograph.build;

/** The closed set of element shapes the builder dispatches on. */
public enum ElementShape {
    /** Scalar content, or complex content flattened onto the owning node. */
    LEAF,
    /** Points at another element's declared id; becomes an edge, never a node. */
    REFERENCE_ONLY,
    COMPLEX_ENTITY,
    ASSOCIATION,
    /** Extension container merged onto the owning node. */
    AUGMENTATION;

    public boolean isNode() {
        return this == COMPLEX_ENTITY || this == ASSOCIATION;
    }
}
