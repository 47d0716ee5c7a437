package info.isaksson.erland.niemtograph.core;

import info.isaksson.erland.niemtograph.convert.DocumentPass;
import info.isaksson.erland.niemtograph.resolve.ReferenceTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only store of the document passes of one shared-namespace batch and of every id they
 * declare.
 *
 * <p>Declarations are kept under fingerprint-qualified keys ({@code fingerprint:rawId}) so equal raw ids
 * from different documents never overwrite each other; lookups by raw id see them in batch order.</p>
 */
final class SharedNamespaceArena {

    /** One declared id of one document. */
    static final class Entry {
        final String fingerprint;
        final String sourceName;
        final ReferenceTable.Declaration declaration;

        Entry(String fingerprint, String sourceName, ReferenceTable.Declaration declaration) {
            this.fingerprint = fingerprint;
            this.sourceName = sourceName;
            this.declaration = declaration;
        }

        String key() {
            return fingerprint + ":" + declaration.rawId;
        }
    }

    private final List<DocumentPass> passes = new ArrayList<>();
    private final Map<String, Entry> byKey = new LinkedHashMap<>();
    private final Map<String, List<Entry>> byRawId = new LinkedHashMap<>();

    void append(DocumentPass pass) {
        passes.add(pass);
        for (ReferenceTable.Declaration d : pass.resolved.references.declarations().values()) {
            Entry e = new Entry(pass.fingerprint(), pass.sourceName(), d);
            if (byKey.putIfAbsent(e.key(), e) == null) {
                byRawId.computeIfAbsent(d.rawId, k -> new ArrayList<>()).add(e);
            }
        }
    }

    List<DocumentPass> passes() {
        return Collections.unmodifiableList(passes);
    }

    /** The first declaration of {@code rawId} in batch order. */
    Optional<Entry> firstDeclaration(String rawId) {
        List<Entry> entries = byRawId.get(rawId);
        return entries == null || entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0));
    }

    /** Every declaration of {@code rawId} in batch order. */
    List<Entry> declarations(String rawId) {
        List<Entry> entries = byRawId.get(rawId);
        return entries == null ? List.of() : Collections.unmodifiableList(entries);
    }

    int size() {
        return byKey.size();
    }
}
