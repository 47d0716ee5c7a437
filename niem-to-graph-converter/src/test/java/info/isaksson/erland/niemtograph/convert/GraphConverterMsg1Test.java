package info.isaksson.erland.niemtograph.convert;

import info.isaksson.erland.niemtograph.graph.GraphEdge;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.graph.GraphNode;
import info.isaksson.erland.niemtograph.graph.GraphSignatures;
import info.isaksson.erland.niemtograph.graph.NodeFlag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class GraphConverterMsg1Test {

    private final GraphConverter converter = new GraphConverter();

    @Test
    void xmlConvertsToNineteenNodesAndTwentyOneEdges() {
        ConversionResult result = converter.convert(TestDocuments.parse("msg1.xml"), ConversionConfig.defaults());
        GraphModel g = result.graph;

        assertEquals(19, g.nodes.size(), "nodes: " + g.nodes);
        assertEquals(21, g.edges.size(), "edges: " + g.edges);
        assertTrue(result.warnings.isEmpty(), "warnings: " + result.warnings);

        Map<GraphEdgeKind, Integer> kinds = GraphSignatures.edgeTypeCounts(g);
        assertEquals(17, kinds.get(GraphEdgeKind.CONTAINS));
        assertEquals(2, kinds.get(GraphEdgeKind.REPRESENTS));
        assertEquals(2, kinds.get(GraphEdgeKind.ASSOCIATED_WITH));
        assertEquals(0, kinds.get(GraphEdgeKind.REFERS_TO));
    }

    @Test
    void driverAndPassengerRolesShareOneHub() {
        GraphModel g = converter.convert(TestDocuments.parse("msg1.xml"), null).graph;

        List<GraphNode> hubs = g.nodes.stream().filter(GraphNode::isHub).collect(Collectors.toList());
        assertEquals(1, hubs.size());
        GraphNode hub = hubs.get(0);
        assertEquals(ConversionConfig.DEFAULT_HUB_LABEL, hub.type);
        assertEquals(List.of("j:CrashDriver", "j:CrashPerson"), hub.roleTypes);
        assertEquals("2", hub.property("roleCount"));
        assertFalse(hub.properties.containsKey("j:PersonAdultIndicator"), "role properties stay on the roles");

        List<GraphEdge> represents = g.edgesOfKind(GraphEdgeKind.REPRESENTS);
        assertEquals(2, represents.size());
        for (GraphEdge e : represents) {
            assertEquals(hub.id, e.targetId);
            String roleType = g.node(e.sourceId).orElseThrow().type;
            assertTrue(hub.roleTypes.contains(roleType), roleType);
        }
    }

    @Test
    void personChargeAssociationLinksBothEndpoints() {
        GraphModel g = converter.convert(TestDocuments.parse("msg1.xml"), null).graph;
        String fp = g.fingerprint;

        GraphNode assoc = g.nodesOfType("j:PersonChargeAssociation").get(0);
        assertTrue(assoc.flags.contains(NodeFlag.ASSOCIATION));

        List<GraphEdge> endpoints = g.outgoing(assoc.id);
        assertEquals(2, endpoints.size());
        assertTrue(endpoints.stream().allMatch(e -> e.kind == GraphEdgeKind.ASSOCIATED_WITH));
        assertEquals(List.of(fp + ":CH01", fp + ":P01"),
                endpoints.stream().map(e -> e.targetId).sorted().collect(Collectors.toList()));
        assertTrue(endpoints.stream().anyMatch(e -> "nc:Person".equals(e.properties.get("role"))));
    }

    @Test
    void leavesBecomePropertiesOfNearestNode() {
        GraphModel g = converter.convert(TestDocuments.parse("msg1.xml"), null).graph;
        String fp = g.fingerprint;

        GraphNode person = g.node(fp + ":P01").orElseThrow();
        assertEquals("nc:Person", person.type);
        assertTrue(person.properties.isEmpty(), "person content is structured: " + person.properties);

        GraphNode name = g.nodesOfType("nc:PersonName").get(0);
        assertEquals("Peter", name.property("nc:PersonGivenName"));
        assertEquals(List.of("Death", "Bredon"), name.properties.get("nc:PersonMiddleName"));
        assertEquals("Wimsey", name.property("nc:PersonSurName"));

        GraphNode vehicle = g.nodesOfType("j:CrashVehicle").get(0);
        assertEquals("A10", vehicle.property("j:CrashDrivingViolationCode"));

        GraphNode charge = g.node(fp + ":CH01").orElseThrow();
        assertEquals("Furious Driving", charge.property("j:ChargeDescriptionText"));
        assertEquals("false", charge.property("j:ChargeFelonyIndicator"));
    }

    @Test
    void jsonEncodingHasTheSameShapeAsXml() {
        GraphModel xml = converter.convert(TestDocuments.parse("msg1.xml"), null).graph;
        ConversionResult jsonResult = converter.convert(TestDocuments.parse("msg1.json"), null);
        GraphModel json = jsonResult.graph;

        assertTrue(jsonResult.warnings.isEmpty(), "warnings: " + jsonResult.warnings);
        assertEquals(19, json.nodes.size());
        assertEquals(21, json.edges.size());
        assertEquals(GraphSignatures.nodeSignatures(xml), GraphSignatures.nodeSignatures(json));
        assertEquals(GraphSignatures.edgeTypeCounts(xml), GraphSignatures.edgeTypeCounts(json));
        assertNotEquals(xml.fingerprint, json.fingerprint);
    }
}
