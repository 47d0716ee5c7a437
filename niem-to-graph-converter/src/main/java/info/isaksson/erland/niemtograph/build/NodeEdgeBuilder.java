package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.document.ElementNode;
import info.isaksson.erland.niemtograph.document.QualifiedName;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import info.isaksson.erland.niemtograph.resolve.ElementInfo;
import info.isaksson.erland.niemtograph.resolve.ResolvedDocument;
import info.isaksson.erland.niemtograph.resolve.ResolvedReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Depth-first walk that turns classified elements into node and edge drafts.
 *
 * <p>Entities become nodes with a CONTAINS edge from the nearest enclosing node; leaves become
 * properties of that node; reference-only elements become REFERS_TO edges from it. Associations and
 * augmentations are recorded for their own phases; the walk still descends into them so nested
 * entities and references are built.</p>
 */
public final class NodeEdgeBuilder {

    private static final Logger log = LoggerFactory.getLogger(NodeEdgeBuilder.class);

    public GraphAssembly build(ResolvedDocument doc) {
        GraphAssembly assembly = new GraphAssembly(doc.document.sourceName, doc.fingerprint());
        visit(doc.root, assembly);
        log.debug("Built {} nodes, {} edges, {} associations, {} augmentations, {} role claims",
                assembly.nodes().size(), assembly.edges().size(), assembly.associations.size(),
                assembly.augmentations.size(), assembly.roleClaims.size());
        return assembly;
    }

    private void visit(ElementInfo info, GraphAssembly assembly) {
        switch (info.shape) {
            case COMPLEX_ENTITY:
                entity(info, assembly);
                break;
            case ASSOCIATION:
                assembly.associations.add(new PendingAssociation(info, info.ownerNodeId()));
                objectMetadata(info, info.nodeId(), assembly);
                visitChildren(info, assembly);
                break;
            case AUGMENTATION:
                assembly.augmentations.add(new AugmentationSite(info, info.ownerNodeId()));
                objectMetadata(info, info.ownerNodeId(), assembly);
                visitChildren(info, assembly);
                break;
            case REFERENCE_ONLY:
                if (info.parent.shape != ElementShape.ASSOCIATION) {
                    referenceEdges(info, info.ownerNodeId(), GraphEdgeKind.REFERS_TO, assembly);
                }
                break;
            case LEAF:
                // the leaf itself is written by whoever owns it; look for shaped content below
                visitChildren(info, assembly);
                break;
            default:
                throw new IllegalStateException("Unhandled shape: " + info.shape);
        }
    }

    private void visitChildren(ElementInfo info, GraphAssembly assembly) {
        for (ElementInfo child : info.children()) {
            visit(child, assembly);
        }
    }

    private void entity(ElementInfo info, GraphAssembly assembly) {
        ElementNode el = info.element;
        NodeDraft draft = new NodeDraft(info.nodeId(), info.nodeType());
        PropertyWriter.writeAttributes(draft, el, "");
        if (el.text != null && !el.nil) {
            draft.addProperty(info.qname(), el.text);
        }
        PropertyWriter.writeLeafChildren(draft, info, "");
        assembly.addNode(draft);

        String owner = info.ownerNodeId();
        if (owner != null && !owner.equals(info.nodeId())) {
            assembly.edge(GraphEdgeKind.CONTAINS, owner, info.nodeId(), null);
        }
        if (el.roleOf != null) {
            assembly.roleClaims.add(new RoleClaim(el.roleOf, info.nodeId(), info.qname(), info.path));
        }
        objectMetadata(info, info.nodeId(), assembly);
        visitChildren(info, assembly);
    }

    private static void objectMetadata(ElementInfo info, String targetNodeId, GraphAssembly assembly) {
        if (info.element.hasMetadataRefs() && targetNodeId != null) {
            assembly.addMetadataSite(new MetadataSite(MetadataSite.Level.OBJECT, targetNodeId, metadataRefs(info.element), info.path));
        }
    }

    /**
     * Emits one edge of {@code kind} per resolved target of a reference-only element. Deferred targets
     * are recorded for shared-namespace reconciliation; unresolved ones were already reported.
     *
     * @return ids of the edges emitted
     */
    public static List<String> referenceEdges(ElementInfo ref, String sourceId, GraphEdgeKind kind, GraphAssembly assembly) {
        List<String> out = new ArrayList<>();
        if (sourceId == null) return out;
        Map<String, Object> props = referenceProperties(ref.element);
        for (ResolvedReference r : ref.references()) {
            if (r.isResolved()) {
                EdgeDraft e = assembly.edge(kind, sourceId, r.targetNodeId, ref.qname());
                props.forEach(e::putIfAbsent);
                out.add(e.id);
                if (ref.element.hasMetadataRefs()) {
                    assembly.addMetadataSite(new MetadataSite(MetadataSite.Level.RELATIONSHIP, e.id, metadataRefs(ref.element), ref.path));
                }
            } else if (r.deferred) {
                assembly.addDeferredReference(new DeferredReference(kind, sourceId, r.rawId, ref.qname(), props, ref.path, ref.element.nil));
            }
        }
        return out;
    }

    /** {@code role} plus the reference element's plain attributes. */
    static Map<String, Object> referenceProperties(ElementNode ref) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("role", ref.name.prefixed());
        for (Map.Entry<QualifiedName, String> a : ref.attributes.entrySet()) {
            props.put(a.getKey().prefixed(), a.getValue());
        }
        return props;
    }

    static Map<String, List<String>> metadataRefs(ElementNode el) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        el.metadataRefs.forEach((k, v) -> out.put(k.prefixed(), v));
        return out;
    }
}
