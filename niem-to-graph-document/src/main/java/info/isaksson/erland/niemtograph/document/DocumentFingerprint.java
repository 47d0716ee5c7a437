package info.isaksson.erland.niemtograph.document;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content fingerprint used to prefix every node id of a document.
 *
 * <p>Byte-identical documents get identical fingerprints, so re-ingesting a document is idempotent,
 * while two documents reusing the same raw ids never collide.</p>
 */
public final class DocumentFingerprint {

    /** Hex characters kept from the SHA-256 digest. */
    public static final int LENGTH = 16;

    private DocumentFingerprint() {}

    public static String of(byte[] content) {
        if (content == null) throw new IllegalArgumentException("content is null");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(content);
            StringBuilder sb = new StringBuilder(LENGTH);
            for (int i = 0; i < LENGTH / 2; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is guaranteed in the JRE.
            throw new IllegalStateException(e);
        }
    }
}
