package info.isaksson.erland.niemtograph.convert;

import info.isaksson.erland.niemtograph.build.GraphAssembly;
import info.isaksson.erland.niemtograph.resolve.ResolvedDocument;

/**
 * A document converted up to, but not including, hub merging and cross-document reference
 * resolution. Produced by {@link GraphConverter#prepare} for shared-namespace batches.
 */
public final class DocumentPass {
    public final ResolvedDocument resolved;
    public final GraphAssembly assembly;
    public final ConversionWarnings warnings;

    DocumentPass(ResolvedDocument resolved, GraphAssembly assembly, ConversionWarnings warnings) {
        this.resolved = resolved;
        this.assembly = assembly;
        this.warnings = warnings;
    }

    public String fingerprint() {
        return resolved.fingerprint();
    }

    public String sourceName() {
        return resolved.document.sourceName;
    }
}
