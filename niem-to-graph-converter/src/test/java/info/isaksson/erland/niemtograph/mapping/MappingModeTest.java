package info.isaksson.erland.niemtograph.mapping;

import info.isaksson.erland.niemtograph.convert.ConversionConfig;
import info.isaksson.erland.niemtograph.convert.ConversionMode;
import info.isaksson.erland.niemtograph.convert.ConversionResult;
import info.isaksson.erland.niemtograph.convert.GraphConverter;
import info.isaksson.erland.niemtograph.convert.TestDocuments;
import info.isaksson.erland.niemtograph.convert.WarningCode;
import info.isaksson.erland.niemtograph.error.ConversionErrorCode;
import info.isaksson.erland.niemtograph.error.MissingMappingException;
import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.graph.GraphNode;
import info.isaksson.erland.niemtograph.graph.GraphSignatures;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class MappingModeTest {

    private final GraphConverter converter = new GraphConverter();

    @Test
    void mappingRulesOverrideStructure() throws Exception {
        ConversionConfig config = ConversionConfig.builder()
                .mode(ConversionMode.MAPPING)
                .mappingTable(crashMapping())
                .strictMapping(true)
                .build();
        ConversionResult result = converter.convert(TestDocuments.parse("msg1.xml"), config);
        GraphModel g = result.graph;

        assertTrue(result.warnings.isEmpty(), "warnings: " + result.warnings);
        assertEquals(11, g.nodes.size(), "nodes: " + g.nodes);
        assertEquals(13, g.edges.size(), "edges: " + g.edges);

        GraphNode person = g.node(g.fingerprint + ":P01").orElseThrow();
        assertEquals("Person", person.type);
        assertEquals("Peter", person.property("nc:PersonName/nc:PersonGivenName"));
        assertEquals(List.of("Death", "Bredon"), person.properties.get("nc:PersonName/nc:PersonMiddleName"));
        assertEquals("1890-05-04", person.property("nc:PersonBirthDate/nc:Date"));

        GraphNode location = g.nodesOfType("nc:ActivityLocation").get(0);
        assertEquals("51.87", location.property(
                "nc:Location2DGeospatialCoordinate/nc:GeographicCoordinateLatitude/nc:LatitudeDegreeValue"));

        assertEquals(1, g.nodesOfType("Charge").size());
        GraphNode assoc = g.nodesOfType("CHARGED_WITH").get(0);
        assertTrue(assoc.isAssociation());
        assertEquals(2, GraphSignatures.edgeTypeCounts(g).get(GraphEdgeKind.REPRESENTS));
    }

    @Test
    void strictMappingRejectsUnmappedEntityTypes() throws Exception {
        Map<String, TypeRule> rules = new TreeMap<>(crashMapping().rules());
        rules.remove("j:CrashVehicle");
        ConversionConfig config = ConversionConfig.builder()
                .mode(ConversionMode.MAPPING)
                .mappingTable(new MappingTable(rules))
                .strictMapping(true)
                .build();

        MissingMappingException ex = assertThrows(MissingMappingException.class,
                () -> converter.convert(TestDocuments.parse("msg1.xml"), config));
        assertEquals(ConversionErrorCode.MISSING_MAPPING, ex.getCode());
        assertEquals("j:CrashVehicle", ex.getTypeName());
        assertEquals("/exch:CrashDriverInfo/j:Crash/j:CrashVehicle", ex.getElementPath());
    }

    @Test
    void lenientMappingFallsBackToStructureOncePerType() throws Exception {
        Map<String, TypeRule> rules = new TreeMap<>(crashMapping().rules());
        rules.remove("j:CrashVehicle");
        rules.remove("nc:ActivityDate");
        ConversionConfig config = ConversionConfig.builder()
                .mode(ConversionMode.MAPPING)
                .mappingTable(new MappingTable(rules))
                .build();

        ConversionResult result = converter.convert(TestDocuments.parse("msg1.xml"), config);
        assertEquals(2, result.warnings.size(), "warnings: " + result.warnings);
        assertTrue(result.warnings.stream().allMatch(w -> w.code == WarningCode.MISSING_MAPPING));
        assertEquals(1, result.graph.nodesOfType("j:CrashVehicle").size());
        assertEquals(1, result.graph.nodesOfType("nc:ActivityDate").size());
    }

    @Test
    void dynamicModeIgnoresTheTable() throws Exception {
        ConversionConfig config = ConversionConfig.builder().mappingTable(crashMapping()).build();
        ConversionResult result = converter.convert(TestDocuments.parse("msg1.xml"), config);
        assertEquals(19, result.nodes().size());
    }

    @Test
    void strictMappingRequiresMappingMode() {
        assertThrows(IllegalArgumentException.class, () -> ConversionConfig.builder().strictMapping(true).build());
    }

    static MappingTable crashMapping() throws Exception {
        try (InputStream in = MappingModeTest.class.getResourceAsStream("/fixtures/mapping-crash.yaml")) {
            assertNotNull(in, "fixture must exist in test resources");
            return MappingTableLoader.load(in, false);
        }
    }
}
