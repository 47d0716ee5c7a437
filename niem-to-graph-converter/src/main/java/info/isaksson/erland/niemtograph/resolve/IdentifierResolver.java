package info.isaksson.erland.niemtograph.resolve;

import info.isaksson.erland.niemtograph.build.ElementShape;
import info.isaksson.erland.niemtograph.build.ShapeClassifier;
import info.isaksson.erland.niemtograph.convert.ConversionConfig;
import info.isaksson.erland.niemtograph.convert.ConversionWarnings;
import info.isaksson.erland.niemtograph.convert.WarningCode;
import info.isaksson.erland.niemtograph.document.ElementNode;
import info.isaksson.erland.niemtograph.document.ParsedDocument;
import info.isaksson.erland.niemtograph.document.QualifiedName;
import info.isaksson.erland.niemtograph.error.DanglingReferenceException;
import info.isaksson.erland.niemtograph.error.IdCollisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns ids and shapes to every element and resolves references against declared ids.
 *
 * <p>Two passes: the first walks the tree in document order, classifies each element and collects
 * declarations; the second resolves every reference-only element against the complete table, so
 * forward references work unless disabled.</p>
 */
public final class IdentifierResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentifierResolver.class);

    private final ConversionConfig config;
    private final ConversionWarnings warnings;
    private final ShapeClassifier classifier;

    public IdentifierResolver(ConversionConfig config, ConversionWarnings warnings) {
        this.config = Objects.requireNonNull(config, "config");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
        this.classifier = new ShapeClassifier(config, warnings);
    }

    /**
     * @param deferUnresolved leave references to ids not declared in this document for a later
     *                        cross-document reconciliation instead of reporting them
     */
    public ResolvedDocument resolve(ParsedDocument doc, boolean deferUnresolved) {
        Objects.requireNonNull(doc, "doc");
        ReferenceTable table = new ReferenceTable();
        List<ElementInfo> all = new ArrayList<>();

        ElementInfo root = walk(doc, doc.root, null, 0, "/" + doc.root.name.prefixed(), false, table, all);
        resolveReferences(all, table, deferUnresolved);

        log.debug("Resolved {} elements, {} declared ids, {} unresolved references in {}",
                all.size(), table.size(), table.unresolved().size(), doc.sourceName);
        return new ResolvedDocument(doc, root, all, table);
    }

    private ElementInfo walk(ParsedDocument doc, ElementNode el, ElementInfo parent, int ordinal, String path,
                             boolean flattening, ReferenceTable table, List<ElementInfo> all) {
        ShapeClassifier.Classification c = classifier.classify(el, parent == null, flattening, path);

        String parentKey = parent == null ? IdStrategy.ROOT_PARENT : parent.key;
        String key = el.declaredId != null
                ? IdStrategy.declaredId(doc.fingerprint, el.declaredId)
                : IdStrategy.syntheticId(doc.fingerprint, parentKey, ordinal, el.name.prefixed());

        ElementInfo info = new ElementInfo(el, parent, ordinal, all.size(), path, c.shape, c.rule, key);
        all.add(info);
        if (parent != null) {
            parent.children.add(info);
            info.ownerNodeId = parent.nodeId != null ? parent.nodeId : parent.ownerNodeId;
        }
        if (c.shape.isNode()) {
            info.nodeId = key;
        }
        if (el.declaredId != null) {
            declare(info, table);
        }

        boolean childFlattening = c.shape == ElementShape.AUGMENTATION || c.shape == ElementShape.LEAF;
        Map<QualifiedName, Integer> nameCounts = new HashMap<>();
        for (ElementNode child : el.children) nameCounts.merge(child.name, 1, Integer::sum);
        Map<QualifiedName, Integer> seen = new HashMap<>();
        for (int i = 0; i < el.children.size(); i++) {
            ElementNode child = el.children.get(i);
            String childPath = path + "/" + child.name.prefixed();
            if (nameCounts.get(child.name) > 1) {
                childPath += "[" + seen.merge(child.name, 1, Integer::sum) + "]";
            }
            walk(doc, child, info, i, childPath, childFlattening, table, all);
        }
        return info;
    }

    /**
     * Registers a declared id. A second declaration with the same qualified name merges onto the first
     * node; a different qualified name is a collision. Ids declared on elements that produce no node
     * (augmentations, flattened content) name the owning node.
     */
    private void declare(ElementInfo info, ReferenceTable table) {
        String rawId = info.element.declaredId;
        String target = info.nodeId != null ? info.nodeId : info.ownerNodeId;
        ReferenceTable.Declaration existing = table.declaration(rawId).orElse(null);
        if (existing == null) {
            table.declare(rawId, target, info.qname(), info.path, info.order);
            return;
        }
        if (!existing.type.equals(info.qname())) {
            throw new IdCollisionException(rawId, existing.type, info.qname(), info.path);
        }
        warnings.warn(WarningCode.DUPLICATE_DECLARATION,
                "Id '" + rawId + "' declared again; merging onto the first declaration at " + existing.path,
                info.path, "rawId", rawId);
        if (info.nodeId != null) {
            info.nodeId = existing.nodeId;
        }
    }

    private void resolveReferences(List<ElementInfo> all, ReferenceTable table, boolean deferUnresolved) {
        for (ElementInfo info : all) {
            if (info.shape != ElementShape.REFERENCE_ONLY) continue;
            for (String rawId : info.element.referenceTargets) {
                ReferenceTable.Declaration d = table.declaration(rawId).orElse(null);
                boolean forward = d != null && d.order > info.order;
                if (d != null && (config.forwardReferences || !forward)) {
                    info.references.add(new ResolvedReference(rawId, d.nodeId, false));
                    continue;
                }
                if (d == null && deferUnresolved) {
                    table.unresolved(rawId, info.path, false, true);
                    info.references.add(new ResolvedReference(rawId, null, true));
                    continue;
                }
                unresolved(info, rawId, forward, table);
            }
        }
    }

    private void unresolved(ElementInfo info, String rawId, boolean forward, ReferenceTable table) {
        boolean tolerated = config.tolerateNilReferences && info.element.nil;
        if (config.strictReferences && !tolerated) {
            throw new DanglingReferenceException(rawId, info.path);
        }
        table.unresolved(rawId, info.path, forward, false);
        info.references.add(new ResolvedReference(rawId, null, false));
        if (forward) {
            log.warn("Forward reference to '{}' at {} is not allowed; edge omitted", rawId, info.path);
            warnings.warn(WarningCode.FORWARD_REFERENCE,
                    "Forward reference to '" + rawId + "' is not allowed; edge omitted", info.path, "rawId", rawId);
        } else {
            log.warn("Unresolved reference to '{}' at {}; edge omitted", rawId, info.path);
            warnings.warn(WarningCode.DANGLING_REFERENCE,
                    "Reference to undeclared id '" + rawId + "'; edge omitted", info.path, "rawId", rawId);
        }
    }
}
