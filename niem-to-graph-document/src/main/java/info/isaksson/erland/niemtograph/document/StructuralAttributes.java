package info.isaksson.erland.niemtograph.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recognition of NIEM structural attributes, shared by the XML and JSON normalizers so both formats
 * classify identically.
 */
public final class StructuralAttributes {

    public static final String STRUCTURES_NS_6 = "https://docs.oasis-open.org/niemopen/ns/model/structures/6.0/";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";

    public static final String STRUCTURES_PREFIX = "structures";
    public static final String XSI_PREFIX = "xsi";

    private StructuralAttributes() {}

    /** Any NIEM release of the structures namespace (3.0 .. 6.0), or the conventional prefix. */
    public static boolean isStructures(QualifiedName name) {
        if (name.namespaceUri != null) {
            return name.namespaceUri.contains("/structures/");
        }
        return STRUCTURES_PREFIX.equals(name.prefix);
    }

    public static boolean isXsi(QualifiedName name) {
        if (name.namespaceUri != null) return XSI_NS.equals(name.namespaceUri);
        return XSI_PREFIX.equals(name.prefix);
    }

    /**
     * Metadata reference attributes: {@code nc:metadataRef}, {@code priv:privacyMetadataRef} and the
     * older {@code structures:metadata} / {@code structures:relationshipMetadata}.
     */
    public static boolean isMetadataReference(QualifiedName name) {
        String local = name.localName;
        if (isStructures(name)) {
            return local.equals("metadata") || local.equals("relationshipMetadata");
        }
        return local.equals("metadataRef") || local.endsWith("MetadataRef");
    }

    public static boolean isTrue(String value) {
        if (value == null) return false;
        String s = value.trim().toLowerCase(Locale.ROOT);
        return s.equals("true") || s.equals("1");
    }

    /** IDREFS style value: whitespace separated tokens. */
    public static List<String> splitIdList(String value) {
        List<String> out = new ArrayList<>();
        if (value == null) return out;
        for (String tok : value.trim().split("\\s+")) {
            if (!tok.isEmpty()) out.add(tok);
        }
        return out;
    }

    /** {@code #P01} and {@code P01} name the same local identifier. */
    public static String stripFragment(String uri) {
        if (uri == null) return null;
        String s = uri.trim();
        return s.startsWith("#") ? s.substring(1) : s;
    }
}
