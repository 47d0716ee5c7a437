package info.isaksson.erland.niemtograph.resolve;

import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic ids for graph nodes and edges.
 *
 * <p>Every node id is prefixed with the document fingerprint, so byte-identical documents reproduce
 * their ids while different documents reusing the same raw id never collide. Hubs created across
 * documents in shared-namespace mode use {@link #SHARED_PREFIX} instead.</p>
 */
public final class IdStrategy {

    public static final String SHARED_PREFIX = "shared";

    /** Parent key used for the document root. */
    static final String ROOT_PARENT = "root";

    private IdStrategy() {}

    /** {@code <fingerprint>:<rawId>} */
    public static String declaredId(String fingerprint, String rawId) {
        return fingerprint + ":" + rawId;
    }

    /** Hash of parent key, child ordinal and qualified name; stable for a given document. */
    public static String syntheticId(String fingerprint, String parentKey, int ordinal, String qualifiedName) {
        return fingerprint + ":syn_" + hash(parentKey + "|" + ordinal + "|" + qualifiedName);
    }

    public static String hubId(String fingerprint, String rawId) {
        return fingerprint + ":hub_" + rawId;
    }

    public static String sharedHubId(String rawId) {
        return SHARED_PREFIX + ":hub_" + rawId;
    }

    /**
     * Edge ids depend on their endpoints, kind and a discriminator (the role name for reference edges),
     * so the same logical edge emitted twice collapses into one.
     */
    public static String edgeId(GraphEdgeKind kind, String sourceId, String targetId, String discriminator) {
        return "e_" + hash(kind.name() + "|" + sourceId + "|" + targetId + "|" + (discriminator == null ? "" : discriminator));
    }

    /**
     * SHA-256 truncated to 8 bytes (16 hex chars); collisions would need billions of elements in one
     * document.
     */
    static String hash(String key) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(key.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 8; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is guaranteed in the JRE.
            throw new IllegalStateException(e);
        }
    }
}
