package info.isaksson.erland.niemtograph.overlay;

import info.isaksson.erland.niemtograph.build.EdgeDraft;
import info.isaksson.erland.niemtograph.build.GraphAssembly;
import info.isaksson.erland.niemtograph.build.MetadataSite;
import info.isaksson.erland.niemtograph.build.NodeDraft;
import info.isaksson.erland.niemtograph.convert.ConversionWarnings;
import info.isaksson.erland.niemtograph.convert.WarningCode;
import info.isaksson.erland.niemtograph.resolve.ReferenceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Copies the fields of referenced metadata blocks onto nodes (object level) and edges (relationship level).
 *
 * <p>Copied keys are {@code <metadata type>/<field>}, e.g. {@code priv:PrivacyMetadata/priv:PrivacyCode}.
 * Values already present are kept. An unresolved metadata reference is a warning only.</p>
 */
public final class MetadataOverlay {

    private static final Logger log = LoggerFactory.getLogger(MetadataOverlay.class);

    private final ConversionWarnings warnings;

    public MetadataOverlay(ConversionWarnings warnings) {
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    public void apply(GraphAssembly assembly, ReferenceTable table) {
        int applied = 0;
        for (MetadataSite site : assembly.metadataSites()) {
            for (Map.Entry<String, List<String>> attr : site.refs.entrySet()) {
                for (String rawId : attr.getValue()) {
                    NodeDraft block = table.resolve(rawId).flatMap(assembly::node).orElse(null);
                    if (block == null) {
                        log.warn("Metadata reference '{}' ({}) at {} does not resolve", rawId, attr.getKey(), site.path);
                        Map<String, String> ctx = new LinkedHashMap<>();
                        ctx.put("rawId", rawId);
                        ctx.put("attribute", attr.getKey());
                        warnings.warn(WarningCode.METADATA_UNRESOLVED,
                                "Metadata reference '" + rawId + "' does not resolve", site.path, ctx);
                        continue;
                    }
                    copy(block, site, assembly);
                    applied++;
                }
            }
        }
        log.debug("Applied {} metadata reference(s)", applied);
    }

    private static void copy(NodeDraft block, MetadataSite site, GraphAssembly assembly) {
        String prefix = block.type() + "/";
        if (site.level == MetadataSite.Level.OBJECT) {
            NodeDraft target = assembly.node(site.targetId).orElse(null);
            if (target == null || target == block) return;
            block.properties().forEach((k, v) -> target.putIfAbsent(prefix + k, v));
        } else {
            EdgeDraft target = assembly.edgeById(site.targetId).orElse(null);
            if (target == null) return;
            block.properties().forEach((k, v) -> target.putIfAbsent(prefix + k, v));
        }
    }
}
