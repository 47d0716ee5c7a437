package info.isaksson.erland.niemtograph.build;

import java.util.List;
import java.util.Map;

/**
 * Metadata references found on an element, with the node (object level) or edge (relationship level)
 * that receives the referenced metadata.
 */
public final class MetadataSite {
    public enum Level { OBJECT, RELATIONSHIP }

    public final Level level;
    /** Node id for {@link Level#OBJECT}, edge id for {@link Level#RELATIONSHIP}. */
    public final String targetId;
    /** Metadata reference attribute ({@code prefix:local}) to referenced raw ids. */
    public final Map<String, List<String>> refs;
    public final String path;

    public MetadataSite(Level level, String targetId, Map<String, List<String>> refs, String path) {
        this.level = level;
        this.targetId = targetId;
        this.refs = refs;
        this.path = path;
    }
}
