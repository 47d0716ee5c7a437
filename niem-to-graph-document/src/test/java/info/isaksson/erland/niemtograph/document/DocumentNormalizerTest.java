package info.isaksson.erland.niemtograph.document;

import info.isaksson.erland.niemtograph.error.DocumentParseException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentNormalizerTest {

    private final DocumentNormalizer normalizer = new DocumentNormalizer();

    @Test
    void detectsFormatAndFingerprints() {
        byte[] xml = "<a><b>1</b></a>".getBytes(StandardCharsets.UTF_8);
        ParsedDocument doc = normalizer.normalize(xml, null, null, "a.xml");
        assertEquals(DocumentFormat.XML, doc.format);
        assertEquals(DocumentFingerprint.LENGTH, doc.fingerprint.length());
        assertEquals("a.xml", doc.sourceName);

        ParsedDocument again = normalizer.normalize(xml.clone(), DocumentFormat.XML, null, null);
        assertEquals(doc.fingerprint, again.fingerprint, "identical bytes give identical fingerprints");
        assertEquals("memory", again.sourceName);

        ParsedDocument json = normalizer.normalize(" {\"b\": 1}".getBytes(StandardCharsets.UTF_8), null, null, null);
        assertEquals(DocumentFormat.JSON, json.format);
        assertNotEquals(doc.fingerprint, json.fingerprint);
    }

    @Test
    void undetectableContentIsParseError() {
        assertThrows(DocumentParseException.class,
                () -> normalizer.normalize("hello".getBytes(StandardCharsets.UTF_8), null, null, null));
    }

    @Test
    void formatFlagsParse() {
        assertNull(DocumentFormat.parseCli("auto"));
        assertEquals(DocumentFormat.JSON, DocumentFormat.parseCli("JSON"));
        assertEquals(DocumentFormat.JSON, DocumentFormat.fromFileName("msg.jsonld"));
        assertThrows(IllegalArgumentException.class, () -> DocumentFormat.parseCli("yaml"));
    }
}
