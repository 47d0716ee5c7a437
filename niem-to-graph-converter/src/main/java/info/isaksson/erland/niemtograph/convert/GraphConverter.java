package info.isaksson.erland.niemtograph.convert;

import info.isaksson.erland.niemtograph.association.AssociationHandler;
import info.isaksson.erland.niemtograph.augment.AugmentationFlattener;
import info.isaksson.erland.niemtograph.build.GraphAssembly;
import info.isaksson.erland.niemtograph.build.NodeEdgeBuilder;
import info.isaksson.erland.niemtograph.document.ParsedDocument;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.hub.HubMerger;
import info.isaksson.erland.niemtograph.hub.HubRegistry;
import info.isaksson.erland.niemtograph.overlay.MetadataOverlay;
import info.isaksson.erland.niemtograph.resolve.IdStrategy;
import info.isaksson.erland.niemtograph.resolve.IdentifierResolver;
import info.isaksson.erland.niemtograph.resolve.ResolvedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Document tree to property graph.
 *
 * <p>Phases run in a fixed order: identifier resolution, node/edge building, hub merging,
 * association handling, augmentation flattening, metadata overlay. A conversion is single threaded
 * and keeps no state between calls, so one converter may serve many threads.</p>
 */
public final class GraphConverter {

    private static final Logger log = LoggerFactory.getLogger(GraphConverter.class);

    /**
     * Converts one document.
     *
     * @throws info.isaksson.erland.niemtograph.error.ConversionException on a fatal error; no partial
     *         graph is returned
     */
    public ConversionResult convert(ParsedDocument doc, ConversionConfig config) {
        Objects.requireNonNull(doc, "doc");
        if (config == null) config = ConversionConfig.defaults();

        ConversionWarnings warnings = new ConversionWarnings();
        ResolvedDocument resolved = new IdentifierResolver(config, warnings).resolve(doc, false);
        GraphAssembly assembly = new NodeEdgeBuilder().build(resolved);

        String fingerprint = doc.fingerprint;
        HubRegistry hubs = new HubMerger(config.hubLabel)
                .merge(assembly, assembly.roleClaims(), rawId -> IdStrategy.hubId(fingerprint, rawId));

        finish(resolved, assembly, warnings);

        GraphModel graph = assembly.freeze();
        log.debug("Converted {}: {} nodes, {} edges, {} hub(s), {} warning(s)",
                doc.sourceName, graph.nodes.size(), graph.edges.size(), hubs.size(), warnings.size());
        return new ConversionResult(graph, warnings.toDeterministicList());
    }

    /**
     * Runs every per-document phase except hub merging, and leaves references to ids that the
     * document does not declare for a later cross-document reconciliation.
     */
    public DocumentPass prepare(ParsedDocument doc, ConversionConfig config) {
        Objects.requireNonNull(doc, "doc");
        if (config == null) config = ConversionConfig.defaults();

        ConversionWarnings warnings = new ConversionWarnings();
        ResolvedDocument resolved = new IdentifierResolver(config, warnings).resolve(doc, true);
        GraphAssembly assembly = new NodeEdgeBuilder().build(resolved);
        finish(resolved, assembly, warnings);
        return new DocumentPass(resolved, assembly, warnings);
    }

    private static void finish(ResolvedDocument resolved, GraphAssembly assembly, ConversionWarnings warnings) {
        new AssociationHandler(warnings).handle(assembly);
        new AugmentationFlattener().flatten(assembly);
        new MetadataOverlay(warnings).apply(assembly, resolved.references);
    }
}
