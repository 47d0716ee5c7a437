package info.isaksson.erland.niemtograph.document;

import info.isaksson.erland.niemtograph.error.DocumentParseException;

/**
 * Converts raw document bytes of one format into an {@link ElementNode} tree.
 *
 * <p>Implementations are stateless and safe to share between threads.</p>
 */
public interface TreeNormalizer {

    /** Deepest element nesting accepted before the document is rejected. */
    int MAX_DEPTH = 256;

    DocumentFormat format();

    /**
     * @param content  raw document bytes
     * @param rootName declared root qualified name ({@code prefix:local}); may be null
     * @throws DocumentParseException on malformed input
     */
    ElementNode normalize(byte[] content, String rootName);
}
