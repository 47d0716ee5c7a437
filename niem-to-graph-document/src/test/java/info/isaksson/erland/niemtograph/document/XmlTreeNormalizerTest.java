package info.isaksson.erland.niemtograph.document;

import info.isaksson.erland.niemtograph.error.ConversionErrorCode;
import info.isaksson.erland.niemtograph.error.DocumentParseException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class XmlTreeNormalizerTest {

    private static final String NS = ""
            + " xmlns:nc=\"https://docs.oasis-open.org/niemopen/ns/model/niem-core/6.0/\""
            + " xmlns:j=\"https://docs.oasis-open.org/niemopen/ns/model/domains/justice/6.0/\""
            + " xmlns:structures=\"https://docs.oasis-open.org/niemopen/ns/model/structures/6.0/\""
            + " xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"";

    private final XmlTreeNormalizer normalizer = new XmlTreeNormalizer();

    @Test
    void liftsStructuralAttributes() {
        String xml = "<j:Report" + NS + ">"
                + "<nc:Person structures:id=\"P01\" nc:metadataRef=\"MD01 MD02\"><nc:PersonGivenName>Peter</nc:PersonGivenName></nc:Person>"
                + "<nc:Person structures:ref=\"P01\" xsi:nil=\"true\"/>"
                + "<j:CrashDriver structures:uri=\"#P01\"><j:PersonAdultIndicator>true</j:PersonAdultIndicator></j:CrashDriver>"
                + "<nc:Person structures:uri=\"#P01\"/>"
                + "</j:Report>";

        ElementNode root = normalizer.normalize(bytes(xml), null);
        assertEquals("j:Report", root.name.prefixed());
        assertEquals(4, root.children.size());

        ElementNode declared = root.children.get(0);
        assertEquals("P01", declared.declaredId);
        assertTrue(declared.attributes.isEmpty(), "structural attributes must not stay plain attributes");
        assertEquals(1, declared.metadataRefs.size());
        assertEquals(java.util.List.of("MD01", "MD02"), declared.metadataRefs.values().iterator().next());

        ElementNode ref = root.children.get(1);
        assertEquals(java.util.List.of("P01"), ref.referenceTargets);
        assertTrue(ref.nil);

        ElementNode role = root.children.get(2);
        assertEquals("P01", role.roleOf);
        assertFalse(role.hasReference());

        ElementNode uriRef = root.children.get(3);
        assertNull(uriRef.roleOf);
        assertEquals(java.util.List.of("P01"), uriRef.referenceTargets);
    }

    @Test
    void keepsSimpleTextAndPlainAttributes() {
        String xml = "<j:Report" + NS + ">"
                + "<nc:Measure nc:unitText=\"km\">  12.5 </nc:Measure>"
                + "</j:Report>";
        ElementNode root = normalizer.normalize(bytes(xml), "j:Report");
        ElementNode measure = root.children.get(0);
        assertEquals(ElementKind.SIMPLE, measure.kind);
        assertEquals("12.5", measure.text);
        assertEquals("km", measure.attributes.get(new QualifiedName(
                "https://docs.oasis-open.org/niemopen/ns/model/niem-core/6.0/", "nc", "unitText")));
        assertEquals(ElementKind.ATTRIBUTE_LIKE, measure.attributeNodes().get(0).kind);
    }

    @Test
    void malformedXmlReportsLocation() {
        DocumentParseException ex = assertThrows(DocumentParseException.class,
                () -> normalizer.normalize(bytes("<a><b></a>"), null));
        assertEquals(ConversionErrorCode.PARSE_ERROR, ex.getCode());
        assertNotNull(ex.getElementPath());
        assertTrue(ex.getElementPath().startsWith("line "), ex.getElementPath());
    }

    @Test
    void doctypeIsRejected() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE a [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><a>&x;</a>";
        assertThrows(DocumentParseException.class, () -> normalizer.normalize(bytes(xml), null));
    }

    @Test
    void declaredRootMustMatch() {
        String xml = "<j:Report" + NS + "/>";
        DocumentParseException ex = assertThrows(DocumentParseException.class,
                () -> normalizer.normalize(bytes(xml), "j:Other"));
        assertEquals("/j:Report", ex.getElementPath());
    }

    @Test
    void excessiveNestingIsRejected() {
        StringBuilder sb = new StringBuilder();
        int depth = TreeNormalizer.MAX_DEPTH + 5;
        for (int i = 0; i < depth; i++) sb.append("<e>");
        for (int i = 0; i < depth; i++) sb.append("</e>");
        assertThrows(DocumentParseException.class, () -> normalizer.normalize(bytes(sb.toString()), null));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
