package info.isaksson.erland.niemtograph.core;

import info.isaksson.erland.niemtograph.convert.ConversionMode;
import info.isaksson.erland.niemtograph.error.ConversionErrorCode;
import info.isaksson.erland.niemtograph.error.DocumentParseException;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import info.isaksson.erland.niemtograph.graph.GraphSignatures;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class NiemToGraphServiceTest {

    private final NiemToGraphService service = new NiemToGraphService();

    @Test
    void convertsCrashDriverMessage() throws Exception {
        NiemToGraphResult r = service.convert(Fixtures.bytes("msg1.xml"), "msg1.xml", new NiemToGraphOptions());

        assertEquals("msg1.xml", r.sourceName);
        assertEquals(16, r.fingerprint.length());
        assertEquals(19, r.graph.nodes.size());
        assertEquals(21, r.graph.edges.size());
        assertFalse(r.hasWarnings());

        assertTrue(r.toJson().contains("\"schemaVersion\""));
        String cypher = r.toCypher();
        assertEquals(1 + 19 + 21, cypher.split("\n").length);
    }

    @Test
    void xmlAndJsonFilesGiveTheSameShape() throws Exception {
        Path dir = Files.createTempDirectory("niem-svc-");
        Fixtures.copy(dir, "msg1.xml", "msg1.json");

        NiemToGraphResult xml = service.convert(dir.resolve("msg1.xml"), null);
        NiemToGraphResult json = service.convert(dir.resolve("msg1.json"), null);

        assertEquals(GraphSignatures.nodeSignatures(xml.graph), GraphSignatures.nodeSignatures(json.graph));
        assertEquals(GraphSignatures.edgeTypeCounts(xml.graph), GraphSignatures.edgeTypeCounts(json.graph));
        assertEquals(2, GraphSignatures.edgeTypeCounts(json.graph).get(GraphEdgeKind.REPRESENTS));
    }

    @Test
    void unexpectedRootIsAParseError() throws Exception {
        NiemToGraphOptions options = new NiemToGraphOptions();
        options.rootName = "exch:SomethingElse";

        DocumentParseException ex = assertThrows(DocumentParseException.class,
                () -> service.convert(Fixtures.bytes("msg1.xml"), "msg1.xml", options));
        assertEquals(ConversionErrorCode.PARSE_ERROR, ex.getCode());
    }

    @Test
    void malformedInputIsAParseError() throws Exception {
        assertThrows(DocumentParseException.class,
                () -> service.convert(Fixtures.bytes("broken.xml"), "broken.xml", null));
    }

    @Test
    void inconsistentOptionsAreRejected() {
        NiemToGraphOptions options = new NiemToGraphOptions();
        options.strictMapping = true;
        assertThrows(IllegalArgumentException.class, options::toConfig);

        options.mode = ConversionMode.MAPPING;
        assertTrue(options.toConfig().strictMapping);
    }

    @Test
    void optionsRoundTripThroughConfig() {
        NiemToGraphOptions options = new NiemToGraphOptions();
        options.hubLabel = "Identity";
        options.strictReferences = false;
        NiemToGraphOptions copy = NiemToGraphOptions.from(options.toConfig());
        assertEquals("Identity", copy.hubLabel);
        assertFalse(copy.strictReferences);
        assertFalse(copy.sharedNamespace, "batch settings are not part of the conversion config");
    }
}
