package info.isaksson.erland.niemtograph.build;

import info.isaksson.erland.niemtograph.resolve.ElementInfo;

/** Association element left for the association handler. */
public final class PendingAssociation {
    public final ElementInfo info;
    /** Nearest enclosing node; the association is contained by it. */
    public final String ownerNodeId;

    PendingAssociation(ElementInfo info, String ownerNodeId) {
        this.info = info;
        this.ownerNodeId = ownerNodeId;
    }
}
