package info.isaksson.erland.niemtograph.resolve;

import info.isaksson.erland.niemtograph.document.ParsedDocument;

import java.util.List;

/** Output of {@link IdentifierResolver}: the element tree annotated with ids, shapes and references. */
public final class ResolvedDocument {
    public final ParsedDocument document;
    public final ElementInfo root;
    /** Every element in pre-order. */
    public final List<ElementInfo> elements;
    public final ReferenceTable references;

    ResolvedDocument(ParsedDocument document, ElementInfo root, List<ElementInfo> elements, ReferenceTable references) {
        this.document = document;
        this.root = root;
        this.elements = List.copyOf(elements);
        this.references = references;
    }

    public String fingerprint() {
        return document.fingerprint;
    }
}
