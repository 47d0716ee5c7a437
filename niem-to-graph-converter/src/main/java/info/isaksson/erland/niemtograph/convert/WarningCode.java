package info.isaksson.erland.niemtograph.convert;

/** Stable codes of non-fatal conversion diagnostics. */
public enum WarningCode {
    DANGLING_REFERENCE,
    FORWARD_REFERENCE,
    MISSING_MAPPING,
    METADATA_UNRESOLVED,
    DUPLICATE_DECLARATION,
    ASSOCIATION_DEGRADED
}
