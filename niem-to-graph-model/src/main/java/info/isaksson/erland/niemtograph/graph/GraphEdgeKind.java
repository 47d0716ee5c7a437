package info.isaksson.erland.niemtograph.graph;

/**
 * Edge types produced by the converter. Keep this closed; relationship detail goes into edge properties.
 */
public enum GraphEdgeKind {
    /** Structural nesting between an element node and its nearest node ancestor. */
    CONTAINS,
    /** Role node to the hub node aggregating one real-world identity. */
    REPRESENTS,
    /** Association node to one of its endpoints. */
    ASSOCIATED_WITH,
    /** Resolved reference (structures:ref, reference-only JSON object) from the owning node. */
    REFERS_TO
}
