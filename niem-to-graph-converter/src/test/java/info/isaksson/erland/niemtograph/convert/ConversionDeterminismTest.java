package info.isaksson.erland.niemtograph.convert;

import info.isaksson.erland.niemtograph.document.DocumentNormalizer;
import info.isaksson.erland.niemtograph.graph.GraphJson;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.graph.GraphNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionDeterminismTest {

    private final GraphConverter converter = new GraphConverter();

    @Test
    void sameBytesGiveIdenticalGraphs() throws Exception {
        GraphModel a = converter.convert(TestDocuments.parse("msg1.xml"), null).graph;
        GraphModel b = converter.convert(TestDocuments.parse("msg1.xml"), null).graph;

        assertEquals(ids(a), ids(b));
        assertEquals(GraphJson.toJsonString(a), GraphJson.toJsonString(b));
        assertEquals(a.edges.stream().map(e -> e.id).collect(Collectors.toList()),
                b.edges.stream().map(e -> e.id).collect(Collectors.toList()));
    }

    @Test
    void differentDocumentsNeverShareIds() {
        byte[] original = TestDocuments.bytes("msg1.xml");
        String changed = new String(original, StandardCharsets.UTF_8).replace("Furious Driving", "Reckless Driving");
        DocumentNormalizer normalizer = new DocumentNormalizer();

        GraphModel a = converter.convert(normalizer.normalize(original, null, null, "a.xml"), null).graph;
        GraphModel b = converter.convert(normalizer.normalize(changed.getBytes(StandardCharsets.UTF_8), null, null, "b.xml"), null).graph;

        Set<String> shared = ids(a);
        shared.retainAll(ids(b));
        assertTrue(shared.isEmpty(), "shared ids: " + shared);
        assertTrue(a.node(a.fingerprint + ":P01").isPresent());
        assertTrue(b.node(b.fingerprint + ":P01").isPresent());
    }

    @Test
    void everyNodeIdCarriesTheFingerprint() {
        GraphModel g = converter.convert(TestDocuments.parse("msg1.xml"), null).graph;
        for (GraphNode n : g.nodes) {
            assertTrue(n.id.startsWith(g.fingerprint + ":"), n.id);
        }
    }

    private static Set<String> ids(GraphModel g) {
        return g.nodes.stream().map(n -> n.id).collect(Collectors.toSet());
    }
}
