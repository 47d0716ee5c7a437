package info.isaksson.erland.niemtograph.resolve;

/** One target of a reference-only element. */
public final class ResolvedReference {
    public final String rawId;
    /** Node id the raw id resolved to; null when unresolved. */
    public final String targetNodeId;
    /** True when resolution is left to the shared-namespace reconciliation. */
    public final boolean deferred;

    ResolvedReference(String rawId, String targetNodeId, boolean deferred) {
        this.rawId = rawId;
        this.targetNodeId = targetNodeId;
        this.deferred = deferred;
    }

    public boolean isResolved() {
        return targetNodeId != null;
    }

    @Override public String toString() {
        return rawId + "->" + (targetNodeId != null ? targetNodeId : deferred ? "(deferred)" : "(unresolved)");
    }
}
