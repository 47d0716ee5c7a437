package info.isaksson.erland.niemtograph.document;

import info.isaksson.erland.niemtograph.error.DocumentParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point of the document layer: picks the normalizer for a format, fingerprints the raw bytes
 * and wraps the result as a {@link ParsedDocument}.
 */
public final class DocumentNormalizer {

    private final XmlTreeNormalizer xml = new XmlTreeNormalizer();
    private final JsonTreeNormalizer json = new JsonTreeNormalizer();

    /**
     * @param content    raw bytes
     * @param format     XML or JSON; null to detect from the content
     * @param rootName   declared root ({@code prefix:local}); may be null
     * @param sourceName provenance label; may be null
     */
    public ParsedDocument normalize(byte[] content, DocumentFormat format, String rootName, String sourceName) {
        if (content == null) throw new IllegalArgumentException("content is null");
        DocumentFormat effective = format != null ? format : DocumentFormat.detect(content);
        if (effective == null) {
            throw new DocumentParseException("Cannot detect document format (expected XML or JSON)", null);
        }
        ElementNode root = normalizerFor(effective).normalize(content, rootName);
        return new ParsedDocument(root, DocumentFingerprint.of(content), effective, sourceName);
    }

    /** Reads a file; the format is taken from the extension, falling back to content sniffing. */
    public ParsedDocument normalize(Path file, DocumentFormat format, String rootName) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        DocumentFormat effective = format != null ? format : DocumentFormat.fromFileName(file.getFileName().toString());
        return normalize(bytes, effective, rootName, file.getFileName().toString());
    }

    public TreeNormalizer normalizerFor(DocumentFormat format) {
        return format == DocumentFormat.JSON ? json : xml;
    }
}
