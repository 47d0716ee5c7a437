package info.isaksson.erland.niemtograph.mapping;

import java.util.Locale;

/** How an element of a mapped type is turned into graph structure. */
public enum RuleKind {
    /** Always a node, even for leaf content. */
    NODE,
    /** Never a node; leaves are written onto the nearest node with path keys. */
    FLATTEN,
    ASSOCIATION,
    AUGMENTATION;

    public static RuleKind parse(String v) {
        if (v == null) throw new IllegalArgumentException("rule kind is null");
        try {
            return RuleKind.valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid rule kind: " + v + " (expected node|flatten|association|augmentation)", e);
        }
    }
}
