package info.isaksson.erland.niemtograph.resolve;

import info.isaksson.erland.niemtograph.graph.GraphEdgeKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class IdStrategyTest {

    @Test
    void idsAreStableAndDistinct() {
        assertEquals("abc:P01", IdStrategy.declaredId("abc", "P01"));
        assertEquals(IdStrategy.syntheticId("abc", "root", 0, "j:Crash"), IdStrategy.syntheticId("abc", "root", 0, "j:Crash"));
        assertNotEquals(IdStrategy.syntheticId("abc", "root", 0, "j:Crash"), IdStrategy.syntheticId("abc", "root", 1, "j:Crash"));
        assertNotEquals(IdStrategy.syntheticId("abc", "root", 0, "j:Crash"), IdStrategy.syntheticId("abd", "root", 0, "j:Crash"));
        assertEquals("shared:hub_P01", IdStrategy.sharedHubId("P01"));

        String e1 = IdStrategy.edgeId(GraphEdgeKind.REFERS_TO, "a", "b", "j:Role");
        assertEquals(e1, IdStrategy.edgeId(GraphEdgeKind.REFERS_TO, "a", "b", "j:Role"));
        assertNotEquals(e1, IdStrategy.edgeId(GraphEdgeKind.REFERS_TO, "a", "b", "j:Other"));
        assertNotEquals(e1, IdStrategy.edgeId(GraphEdgeKind.ASSOCIATED_WITH, "a", "b", "j:Role"));
    }
}
