package info.isaksson.erland.niemtograph.convert;

import info.isaksson.erland.niemtograph.document.DocumentNormalizer;
import info.isaksson.erland.niemtograph.document.ParsedDocument;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads fixtures from {@code src/test/resources/fixtures}. */
public final class TestDocuments {

    private static final DocumentNormalizer NORMALIZER = new DocumentNormalizer();

    private TestDocuments() {}

    public static byte[] bytes(String fixture) {
        try (InputStream in = TestDocuments.class.getResourceAsStream("/fixtures/" + fixture)) {
            if (in == null) throw new IllegalArgumentException("fixture must exist in test resources: " + fixture);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ParsedDocument parse(String fixture) {
        return NORMALIZER.normalize(bytes(fixture), null, null, fixture);
    }

    public static ParsedDocument parseString(String content, String name) {
        return NORMALIZER.normalize(content.getBytes(StandardCharsets.UTF_8), null, null, name);
    }
}
