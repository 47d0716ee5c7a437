package info.isaksson.erland.niemtograph.document;

import java.util.Objects;

/** A normalized document tree together with its provenance. */
public final class ParsedDocument {
    public final ElementNode root;
    public final String fingerprint;
    public final DocumentFormat format;
    /** File name or caller supplied label; used for provenance only. */
    public final String sourceName;

    public ParsedDocument(ElementNode root, String fingerprint, DocumentFormat format, String sourceName) {
        this.root = Objects.requireNonNull(root, "root");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.format = format;
        this.sourceName = sourceName == null ? "memory" : sourceName;
    }
}
