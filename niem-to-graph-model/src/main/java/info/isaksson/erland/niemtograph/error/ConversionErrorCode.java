package info.isaksson.erland.niemtograph.error;

/**
 * Stable codes for fatal conversion failures. Every code aborts the current document; nothing partial
 * is returned.
 */
public enum ConversionErrorCode {
    /** Malformed markup, unresolved namespace prefix or invalid JSON structure. */
    PARSE_ERROR,
    /** A reference names an identifier that no element declares (strict reference policy). */
    DANGLING_REFERENCE,
    /** Mapping mode with strict mapping: a complex element type has no mapping rule. */
    MISSING_MAPPING,
    /** One raw identifier declared by two structurally incompatible elements. */
    ID_COLLISION
}
