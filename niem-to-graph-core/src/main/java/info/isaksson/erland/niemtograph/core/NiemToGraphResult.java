package info.isaksson.erland.niemtograph.core;

import info.isaksson.erland.niemtograph.convert.ConversionResult;
import info.isaksson.erland.niemtograph.convert.ConversionWarning;
import info.isaksson.erland.niemtograph.cypher.CypherWriter;
import info.isaksson.erland.niemtograph.graph.GraphJson;
import info.isaksson.erland.niemtograph.graph.GraphModel;

import java.io.IOException;
import java.util.List;

/** Conversion result container for programmatic usage. */
public final class NiemToGraphResult {
    /** File name or caller supplied name; {@code batch} for a shared-namespace graph. */
    public final String sourceName;

    /** Content fingerprint; null for a shared-namespace graph. */
    public final String fingerprint;

    public final GraphModel graph;

    /** Non-fatal diagnostics in deterministic order. */
    public final List<ConversionWarning> warnings;

    NiemToGraphResult(String sourceName, String fingerprint, ConversionResult result) {
        this.sourceName = sourceName;
        this.fingerprint = fingerprint;
        this.graph = result.graph;
        this.warnings = result.warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /** Deterministic graph JSON. */
    public String toJson() throws IOException {
        return GraphJson.toJsonString(graph);
    }

    /** Cypher {@code MERGE} script for the graph. */
    public String toCypher() {
        return CypherWriter.render(graph);
    }
}
