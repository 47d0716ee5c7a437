package info.isaksson.erland.niemtograph.document;

public enum ElementKind {
    /** Has element children. */
    COMPLEX,
    /** Leaf scalar content (possibly empty or nil). */
    SIMPLE,
    /** Synthesized view of an XML attribute or a lower-camel JSON scalar key. */
    ATTRIBUTE_LIKE
}
