package info.isaksson.erland.niemtograph.augment;

import info.isaksson.erland.niemtograph.convert.ConversionConfig;
import info.isaksson.erland.niemtograph.convert.ConversionMode;
import info.isaksson.erland.niemtograph.convert.ConversionResult;
import info.isaksson.erland.niemtograph.convert.GraphConverter;
import info.isaksson.erland.niemtograph.convert.TestDocuments;
import info.isaksson.erland.niemtograph.graph.GraphModel;
import info.isaksson.erland.niemtograph.graph.GraphNode;
import info.isaksson.erland.niemtograph.mapping.MappingTable;
import info.isaksson.erland.niemtograph.mapping.RuleKind;
import info.isaksson.erland.niemtograph.mapping.TypeRule;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AugmentationFlattenerTest {

    private final GraphConverter converter = new GraphConverter();

    @Test
    void augmentationPropertiesLandOnTheCharge() {
        ConversionResult result = converter.convert(TestDocuments.parse("augmentation.xml"), null);
        GraphModel g = result.graph;

        assertEquals(2, g.nodes.size(), "root and charge only: " + g.nodes);
        assertTrue(g.nodesOfType("j:ChargeAugmentation").isEmpty());

        GraphNode charge = g.node(g.fingerprint + ":CH01").orElseThrow();
        assertTrue(charge.isAugmentationHost());
        assertEquals("Furious Driving", charge.property("j:ChargeDescriptionText"));
        assertEquals("false", charge.property("j:ChargeAugmentation/j:ChargeDomesticViolenceIndicator"));
        assertEquals("true", charge.property("j:ChargeAugmentation/j:ChargeHateCrimeIndicator"));
        assertEquals(3, charge.properties.size());
        assertTrue(result.warnings.isEmpty());
    }

    @Test
    void nestedContentAndIdentifiedEntitiesInsideAugmentation() {
        String xml = "<j:Report xmlns:j=\"urn:j\" xmlns:nc=\"urn:nc\""
                + " xmlns:structures=\"https://docs.oasis-open.org/niemopen/ns/model/structures/6.0/\">"
                + "<nc:Person structures:id=\"P1\">"
                + "<j:PersonAugmentation structures:id=\"PA1\" j:source=\"dmv\">"
                + "<j:PersonEyeColor><nc:ColorText>Grey</nc:ColorText></j:PersonEyeColor>"
                + "<nc:Vehicle structures:id=\"V1\"><nc:VehicleMakeCode>Daimler</nc:VehicleMakeCode></nc:Vehicle>"
                + "</j:PersonAugmentation>"
                + "</nc:Person>"
                + "<j:Witness structures:ref=\"PA1\"/>"
                + "</j:Report>";
        GraphModel g = converter.convert(TestDocuments.parseString(xml, "aug.xml"), null).graph;

        GraphNode person = g.node(g.fingerprint + ":P1").orElseThrow();
        assertEquals("Grey", person.property("j:PersonAugmentation/j:PersonEyeColor/nc:ColorText"));
        assertEquals("dmv", person.property("j:PersonAugmentation/@j:source"));

        GraphNode vehicle = g.node(g.fingerprint + ":V1").orElseThrow();
        assertTrue(g.outgoing(person.id).stream().anyMatch(e -> e.targetId.equals(vehicle.id)),
                "identified entity inside an augmentation is contained by the augmented node");

        // the augmentation's own id names the augmented node
        assertTrue(g.outgoing(g.nodes.get(0).id).stream()
                .anyMatch(e -> e.targetId.equals(person.id) && "j:Witness".equals(e.properties.get("role"))));
        assertEquals(3, g.nodes.size());
    }

    @Test
    void mappingRuleCanDeclareAnAugmentation() {
        String xml = "<j:Report xmlns:j=\"urn:j\"><j:Charge><j:ChargeText>x</j:ChargeText>"
                + "<j:ChargeExtra><j:ChargeFlag>true</j:ChargeFlag></j:ChargeExtra></j:Charge></j:Report>";
        MappingTable table = new MappingTable(java.util.Map.of(
                "j:Report", TypeRule.of(RuleKind.NODE),
                "j:Charge", TypeRule.of(RuleKind.NODE),
                "j:ChargeExtra", TypeRule.of(RuleKind.AUGMENTATION)));
        ConversionConfig config = ConversionConfig.builder().mode(ConversionMode.MAPPING).mappingTable(table).build();

        GraphModel g = converter.convert(TestDocuments.parseString(xml, "m.xml"), config).graph;
        assertEquals(2, g.nodes.size());
        assertEquals("true", g.nodesOfType("j:Charge").get(0).property("j:ChargeExtra/j:ChargeFlag"));
    }
}
