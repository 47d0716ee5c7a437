package info.isaksson.erland.niemtograph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GraphJsonDeterminismTest {

    @Test
    void writeIsIndependentOfCreationOrder() throws Exception {
        GraphModel a = sample(false);
        GraphModel b = sample(true);

        String ja = GraphJson.toJsonString(a);
        String jb = GraphJson.toJsonString(b);
        assertEquals(ja, jb, "Insertion order must not leak into the JSON output.");

        Path tmp = Files.createTempFile("graphjson-", ".json");
        GraphJson.write(a, tmp);
        String written = Files.readString(tmp, StandardCharsets.UTF_8);
        assertEquals(ja, written);
        assertTrue(written.endsWith("\n"));

        Path tmp2 = Files.createTempFile("graphjson-", ".json");
        GraphJson.write(a, tmp2);
        assertEquals(written, Files.readString(tmp2, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
    }

    @Test
    void readBackIsSemanticallyEqual() throws Exception {
        GraphModel model = sample(false);
        String json = GraphJson.toJsonString(model);
        GraphModel back = GraphJson.readFromString(json);

        assertEquals(GraphNormalizer.normalize(model), back);
        assertTrue(back.node("fp:hub_P01").orElseThrow().isHub());
        assertEquals(List.of("j:CrashDriver", "j:CrashPerson"), back.node("fp:hub_P01").orElseThrow().roleTypes);

        ObjectMapper om = new ObjectMapper();
        JsonNode tree = om.readTree(json);
        assertEquals(GraphModel.SCHEMA_VERSION, tree.get("schemaVersion").asText());
        assertFalse(tree.get("nodes").get(0).has("flags"), "empty flags are omitted");
    }

    private static GraphModel sample(boolean reversed) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("nc:PersonGivenName", "Peter");
        props.put("nc:PersonMiddleName", List.of("Death", "Bredon"));
        GraphNode person = new GraphNode("fp:P01", "nc:Person", props);

        GraphNode driver = new GraphNode("fp:syn_a", "j:CrashDriver", Map.of("j:PersonAdultIndicator", "true"));
        GraphNode passenger = new GraphNode("fp:syn_b", "j:CrashPerson", Map.of());
        GraphNode hub = new GraphNode("fp:hub_P01", "Entity", Map.of("roleCount", 2),
                EnumSet.of(NodeFlag.HUB), List.of("j:CrashDriver", "j:CrashPerson"));

        GraphEdge r1 = new GraphEdge("e1", GraphEdgeKind.REPRESENTS, "fp:hub_P01", "fp:syn_a", Map.of());
        GraphEdge r2 = new GraphEdge("e2", GraphEdgeKind.REPRESENTS, "fp:hub_P01", "fp:syn_b", Map.of());
        GraphEdge c = new GraphEdge("e3", GraphEdgeKind.CONTAINS, "fp:syn_a", "fp:P01", Map.of());

        List<GraphNode> nodes = reversed ? List.of(hub, passenger, driver, person) : List.of(person, driver, passenger, hub);
        List<GraphEdge> edges = reversed ? List.of(c, r2, r1) : List.of(r1, r2, c);
        return new GraphModel("msg.xml", "fp", nodes, edges);
    }
}
