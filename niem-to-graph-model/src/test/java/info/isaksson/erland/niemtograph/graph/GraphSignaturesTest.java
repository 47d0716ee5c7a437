package info.isaksson.erland.niemtograph.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GraphSignaturesTest {

    @Test
    void signaturesIgnoreIdsAndValues() {
        GraphModel a = new GraphModel("a.xml", "aaaa", List.of(
                new GraphNode("aaaa:P01", "nc:Person", Map.of("nc:PersonGivenName", "Peter")),
                new GraphNode("aaaa:P02", "nc:Person", Map.of("nc:PersonGivenName", "Harriet"))
        ), List.of(new GraphEdge("x", GraphEdgeKind.REFERS_TO, "aaaa:P01", "aaaa:P02", Map.of())));

        GraphModel b = new GraphModel("b.json", "bbbb", List.of(
                new GraphNode("bbbb:P02", "nc:Person", Map.of("nc:PersonGivenName", "H.")),
                new GraphNode("bbbb:P01", "nc:Person", Map.of("nc:PersonGivenName", "P."))
        ), List.of(new GraphEdge("y", GraphEdgeKind.REFERS_TO, "bbbb:P02", "bbbb:P01", Map.of())));

        assertEquals(Map.of("nc:Person[nc:PersonGivenName]", 2), GraphSignatures.nodeSignatures(a));
        assertEquals(GraphSignatures.nodeSignatures(a), GraphSignatures.nodeSignatures(b));
        assertEquals(GraphSignatures.edgeTypeCounts(a), GraphSignatures.edgeTypeCounts(b));
        assertEquals(1, GraphSignatures.edgeTypeCounts(a).get(GraphEdgeKind.REFERS_TO));
    }

    @Test
    void listValuesRenderCommaSeparated() {
        GraphNode n = new GraphNode("id", "nc:PersonName", Map.of("nc:PersonMiddleName", List.of("Death", "Bredon")));
        assertEquals("Death,Bredon", n.property("nc:PersonMiddleName"));
        assertNull(n.property("missing"));
    }
}
