package info.isaksson.erland.niemtograph.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch conversion: one entry per input document in input order, plus the merged graph
 * in shared-namespace mode.
 */
public final class BatchResult {

    /** What happened to one input document. */
    public static final class DocumentOutcome {
        public final Path source;

        /** Per-document graph in standard mode; null in shared-namespace mode and on failure. */
        public final NiemToGraphResult result;

        /** Fatal error of this document, or null. */
        public final Exception failure;

        DocumentOutcome(Path source, NiemToGraphResult result, Exception failure) {
            this.source = source;
            this.result = result;
            this.failure = failure;
        }

        public boolean succeeded() {
            return failure == null;
        }
    }

    public final List<DocumentOutcome> documents;

    /** Shared-namespace mode only; null otherwise. */
    public final NiemToGraphResult merged;

    BatchResult(List<DocumentOutcome> documents, NiemToGraphResult merged) {
        this.documents = List.copyOf(documents);
        this.merged = merged;
    }

    public boolean isShared() {
        return merged != null;
    }

    public List<DocumentOutcome> failures() {
        List<DocumentOutcome> out = new ArrayList<>();
        for (DocumentOutcome d : documents) {
            if (!d.succeeded()) out.add(d);
        }
        return out;
    }

    public boolean hasWarnings() {
        if (merged != null && merged.hasWarnings()) return true;
        for (DocumentOutcome d : documents) {
            if (d.result != null && d.result.hasWarnings()) return true;
        }
        return false;
    }
}
