package info.isaksson.erland.niemtograph.association;

import info.isaksson.erland.niemtograph.build.ElementShape;
import info.isaksson.erland.niemtograph.build.GraphAssembly;
import info.isaksson.erland.niemtograph.build.NodeDraft;
import info.isaksson.erland.niemtograph.build.NodeEdgeBuilder;
import info.isaksson.erland.niemtograph.build.PendingAssociation;
import info.isaksson.erland.niemtograph.build.PropertyWriter;
import info.isaksson.erland.niemtograph.convert.ConversionWarnings;
import info.isaksson.erland.niemtograph.convert.WarningCode;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import info.isaksson.erland.niemtograph.graph.NodeFlag;
import info.isaksson.erland.niemtograph.resolve.ElementInfo;
import info.isaksson.erland.niemtograph.resolve.ResolvedReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Turns association elements into association nodes with one ASSOCIATED_WITH edge per endpoint.
 *
 * <p>An association with fewer than two usable endpoints is degraded: it stays a plain node without
 * the association flag and its endpoints become REFERS_TO edges.</p>
 */
public final class AssociationHandler {

    private static final Logger log = LoggerFactory.getLogger(AssociationHandler.class);

    private final ConversionWarnings warnings;

    public AssociationHandler(ConversionWarnings warnings) {
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    public void handle(GraphAssembly assembly) {
        int degraded = 0;
        for (PendingAssociation pending : assembly.associations()) {
            if (!handle(pending, assembly)) degraded++;
        }
        log.debug("Handled {} association(s), {} degraded", assembly.associations().size(), degraded);
    }

    private boolean handle(PendingAssociation pending, GraphAssembly assembly) {
        ElementInfo info = pending.info;
        NodeDraft draft = new NodeDraft(info.nodeId(), info.nodeType());
        PropertyWriter.writeAttributes(draft, info.element, "");
        PropertyWriter.writeLeafChildren(draft, info, "");

        Set<String> endpointKeys = new LinkedHashSet<>();
        Set<String> endpointTargets = new LinkedHashSet<>();
        for (ElementInfo child : info.children()) {
            if (child.shape != ElementShape.REFERENCE_ONLY) continue;
            for (ResolvedReference r : child.references()) {
                if (r.isResolved()) {
                    endpointKeys.add(r.targetNodeId + "|" + child.qname());
                    endpointTargets.add(r.targetNodeId);
                } else if (r.deferred) {
                    endpointKeys.add("deferred:" + r.rawId + "|" + child.qname());
                }
            }
        }

        boolean complete = endpointKeys.size() >= 2;
        if (complete) {
            draft.addFlag(NodeFlag.ASSOCIATION);
        } else {
            log.warn("Association {} has {} usable endpoint(s); kept as a plain node", info.path, endpointKeys.size());
            warnings.warn(WarningCode.ASSOCIATION_DEGRADED,
                    "Association has " + endpointKeys.size() + " usable endpoint(s); kept as a plain node",
                    info.path, "type", info.qname());
        }
        assembly.addNode(draft);

        if (pending.ownerNodeId != null) {
            assembly.edge(GraphEdgeKind.CONTAINS, pending.ownerNodeId, info.nodeId(), null);
        }

        GraphEdgeKind kind = complete ? GraphEdgeKind.ASSOCIATED_WITH : GraphEdgeKind.REFERS_TO;
        for (ElementInfo child : info.children()) {
            if (child.shape == ElementShape.REFERENCE_ONLY) {
                NodeEdgeBuilder.referenceEdges(child, info.nodeId(), kind, assembly);
            }
        }

        // an endpoint is linked once, by its endpoint edge
        assembly.removeEdges(GraphEdgeKind.CONTAINS, info.nodeId(), endpointTargets);
        return complete;
    }
}
