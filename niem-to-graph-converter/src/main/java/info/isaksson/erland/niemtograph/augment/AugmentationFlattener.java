package info.isaksson.erland.niemtograph.augment;

import info.isaksson.erland.niemtograph.build.AugmentationSite;
import info.isaksson.erland.niemtograph.build.GraphAssembly;
import info.isaksson.erland.niemtograph.build.NodeDraft;
import info.isaksson.erland.niemtograph.build.PropertyWriter;
import info.isaksson.erland.niemtograph.graph.NodeFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges augmentation content onto the owning node.
 *
 * <p>Keys are prefixed with the augmentation's qualified name ({@code j:ChargeAugmentation/j:ChargeHateCrimeIndicator})
 * so they never collide with the owner's base properties. The owner is flagged as an augmentation host.</p>
 */
public final class AugmentationFlattener {

    private static final Logger log = LoggerFactory.getLogger(AugmentationFlattener.class);

    public void flatten(GraphAssembly assembly) {
        for (AugmentationSite site : assembly.augmentations()) {
            NodeDraft owner = assembly.requireNode(site.ownerNodeId);
            String prefix = site.info.qname() + "/";
            PropertyWriter.writeAttributes(owner, site.info.element, prefix + "@");
            PropertyWriter.writeLeafChildren(owner, site.info, prefix);
            owner.addFlag(NodeFlag.AUGMENTATION_HOST);
        }
        log.debug("Flattened {} augmentation(s)", assembly.augmentations().size());
    }
}
