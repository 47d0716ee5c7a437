package info.isaksson.erland.niemtograph.core;

import info.isaksson.erland.niemtograph.build.DeferredReference;
import info.isaksson.erland.niemtograph.build.EdgeDraft;
import info.isaksson.erland.niemtograph.build.GraphAssembly;
import info.isaksson.erland.niemtograph.build.NodeDraft;
import info.isaksson.erland.niemtograph.convert.ConversionConfig;
import info.isaksson.erland.niemtograph.convert.ConversionResult;
import info.isaksson.erland.niemtograph.convert.ConversionWarnings;
import info.isaksson.erland.niemtograph.convert.DocumentPass;
import info.isaksson.erland.niemtograph.convert.WarningCode;
import info.isaksson.erland.niemtograph.error.DanglingReferenceException;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.graph.NodeFlag;
import info.isaksson.erland.niemtograph.hub.HubMerger;
import info.isaksson.erland.niemtograph.hub.HubRegistry;
import info.isaksson.erland.niemtograph.resolve.IdStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-threaded merge phase of a shared-namespace batch.
 *
 * <p>Runs after every document has completed its own pass. Hubs are created over the role claims of
 * all documents, with ids that do not depend on any document fingerprint, and references left open by
 * one document are resolved against ids declared by the others. When several documents declare the
 * same id, the first one in batch order wins.</p>
 */
final class SharedNamespaceReconciler {

    private static final Logger log = LoggerFactory.getLogger(SharedNamespaceReconciler.class);

    static final String BATCH_SOURCE = "batch";
    static final String TARGET_DOC = "targetDoc";

    private final ConversionConfig config;

    SharedNamespaceReconciler(ConversionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param passes per-document passes in batch order
     * @throws DanglingReferenceException with strict references, for a reference no document declares,
     *         unless the referring element is nil and nil references are tolerated
     */
    ConversionResult reconcile(List<DocumentPass> passes) {
        SharedNamespaceArena arena = new SharedNamespaceArena();
        GraphAssembly merged = new GraphAssembly(BATCH_SOURCE, null);
        ConversionWarnings warnings = new ConversionWarnings();
        for (DocumentPass pass : passes) {
            arena.append(pass);
            merged.mergeFrom(pass.assembly);
            warnings.addAll(pass.warnings.toDeterministicList());
        }

        HubRegistry hubs = new HubMerger(config.hubLabel).merge(merged, merged.roleClaims(), IdStrategy::sharedHubId);

        int resolved = 0;
        int dangling = 0;
        Map<String, String> openAssociations = new LinkedHashMap<>();
        for (DocumentPass pass : arena.passes()) {
            for (DeferredReference ref : pass.assembly.deferredReferences()) {
                Optional<SharedNamespaceArena.Entry> target = arena.firstDeclaration(ref.rawId);
                if (target.isPresent()) {
                    link(merged, ref, target.get(), arena.declarations(ref.rawId).size());
                    resolved++;
                    continue;
                }
                boolean tolerated = config.tolerateNilReferences && ref.nil;
                if (config.strictReferences && !tolerated) {
                    log.error("Reference to {} at {} in {} is not declared by any document of the batch",
                            ref.rawId, ref.path, pass.sourceName());
                    throw new DanglingReferenceException(ref.rawId, ref.path);
                }
                dangling++;
                log.warn("Reference to {} at {} in {} is not declared by any document of the batch",
                        ref.rawId, ref.path, pass.sourceName());
                warnings.warn(WarningCode.DANGLING_REFERENCE,
                        "Reference to " + ref.rawId + " is not declared by any document of the batch",
                        ref.path, "source", pass.sourceName());
                if (ref.kind == GraphEdgeKind.ASSOCIATED_WITH) {
                    openAssociations.putIfAbsent(ref.sourceNodeId, parentPath(ref.path));
                }
            }
        }
        openAssociations.forEach((nodeId, path) -> degradeIfIncomplete(merged, nodeId, path, warnings));

        GraphModel graph = merged.freeze();
        log.debug("Reconciled {} document(s), {} declaration(s): {} hub(s), {} cross-document reference(s), {} dangling",
                passes.size(), arena.size(), hubs.size(), resolved, dangling);
        return new ConversionResult(graph, warnings.toDeterministicList());
    }

    /** Same rule as for a single document: an association needs two ASSOCIATED_WITH edges. */
    private static void degradeIfIncomplete(GraphAssembly merged, String nodeId, String path, ConversionWarnings warnings) {
        NodeDraft node = merged.requireNode(nodeId);
        if (!node.hasFlag(NodeFlag.ASSOCIATION)) return;
        long endpoints = merged.edges().stream()
                .filter(e -> e.kind == GraphEdgeKind.ASSOCIATED_WITH && e.sourceId.equals(nodeId))
                .count();
        if (endpoints >= 2) return;

        node.removeFlag(NodeFlag.ASSOCIATION);
        merged.rekindEdges(nodeId, GraphEdgeKind.ASSOCIATED_WITH, GraphEdgeKind.REFERS_TO);
        log.warn("Association {} has {} usable endpoint(s) after reconciliation; kept as a plain node", path, endpoints);
        warnings.warn(WarningCode.ASSOCIATION_DEGRADED,
                "Association has " + endpoints + " usable endpoint(s); kept as a plain node",
                path, "type", node.type());
    }

    private static String parentPath(String path) {
        int slash = path.lastIndexOf('/');
        return slash > 0 ? path.substring(0, slash) : path;
    }

    private static void link(GraphAssembly merged, DeferredReference ref, SharedNamespaceArena.Entry target, int candidates) {
        if (candidates > 1) {
            log.debug("{} is declared by {} documents; using {}", ref.rawId, candidates, target.sourceName);
        }
        EdgeDraft e = merged.edge(ref.kind, ref.sourceNodeId, target.declaration.nodeId, ref.role);
        ref.properties.forEach(e::putIfAbsent);
        e.putIfAbsent(TARGET_DOC, target.sourceName);
    }
}
