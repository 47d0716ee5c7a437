package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.resolve.ElementInfo;

/** Augmentation container and the node its content is merged onto. */
public final class AugmentationSite {
    public final ElementInfo info;
    public final String ownerNodeId;

    AugmentationSite(ElementInfo info, String ownerNodeId) {
        this.info = info;
        this.ownerNodeId = ownerNodeId;
    }
}
