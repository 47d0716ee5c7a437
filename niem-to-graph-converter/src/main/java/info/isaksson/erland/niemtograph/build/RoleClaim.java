package info.isaksson.erland.niemtograph.build;

/** A node that plays a role for an identity named by {@code structures:uri}. */
public final class RoleClaim {
    public final String rawId;
    public final String nodeId;
    public final String roleType;
    public final String path;

    public RoleClaim(String rawId, String nodeId, String roleType, String path) {
        this.rawId = rawId;
        this.nodeId = nodeId;
        this.roleType = roleType;
        this.path = path;
    }
}
