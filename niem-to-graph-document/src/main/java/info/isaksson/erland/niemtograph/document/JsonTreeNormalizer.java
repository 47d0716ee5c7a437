package info.isaksson.erland.niemtograph.document;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import info.isaksson.erland.niemtograph.error.DocumentParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NIEM JSON (JSON-LD flavoured) to {@link ElementNode}.
 *
 * <p>Mapping rules, chosen so that a document and its XML encoding normalize to the same tree:</p>
 * <ul>
 *   <li>{@code @context} binds prefixes to namespaces; {@code structures} and {@code xsi} are always known</li>
 *   <li>an object holding only {@code @id} is a reference; {@code @id} starting with {@code #} on an object
 *       with content is a role claim; any other {@code @id} declares the object's id</li>
 *   <li>{@code @value} is simple content</li>
 *   <li>scalar keys whose local name starts lower-case are attributes (NIEM names attributes lowerCamelCase)</li>
 *   <li>arrays become repeated children in array order; {@code null} becomes a nil child</li>
 * </ul>
 */
public final class JsonTreeNormalizer implements TreeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(JsonTreeNormalizer.class);

    static final String DEFAULT_ROOT = "Document";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);

    @Override
    public DocumentFormat format() {
        return DocumentFormat.JSON;
    }

    @Override
    public ElementNode normalize(byte[] content, String rootName) {
        if (content == null) throw new IllegalArgumentException("content is null");
        JsonNode tree;
        try {
            tree = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            String where = loc == null ? null : "line " + loc.getLineNr() + ", column " + loc.getColumnNr();
            throw new DocumentParseException("Malformed JSON: " + e.getOriginalMessage(), where, e);
        } catch (IOException e) {
            throw new DocumentParseException("Malformed JSON: " + e.getMessage(), null, e);
        }
        if (tree == null || !tree.isObject()) {
            throw new DocumentParseException("NIEM JSON document must be a JSON object", "/");
        }

        Map<String, String> context = readContext(tree.get("@context"));
        QualifiedName rootQn = rootName(tree, rootName, context);
        ElementNode root = convertObject((ObjectNode) tree, rootQn, context, "/" + rootQn, 0);
        log.debug("Normalized JSON document with root {}", rootQn);
        return root;
    }

    private static Map<String, String> readContext(JsonNode ctx) {
        Map<String, String> out = new LinkedHashMap<>();
        if (ctx == null || ctx.isNull()) return out;
        if (!ctx.isObject()) {
            throw new DocumentParseException("@context must be an object", "/@context");
        }
        Iterator<Map.Entry<String, JsonNode>> it = ctx.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().isTextual()) {
                out.put(e.getKey(), e.getValue().asText());
            }
        }
        return out;
    }

    private static QualifiedName rootName(JsonNode tree, String declared, Map<String, String> context) {
        String raw = declared;
        if (raw == null || raw.isBlank()) {
            JsonNode type = tree.get("@type");
            raw = type != null && type.isTextual() ? type.asText() : DEFAULT_ROOT;
        }
        return resolve(raw.trim(), context, "/");
    }

    private static QualifiedName resolve(String key, Map<String, String> context, String path) {
        int idx = key.indexOf(':');
        if (idx < 0) return QualifiedName.local(key);
        String prefix = key.substring(0, idx);
        String local = key.substring(idx + 1);
        String uri = context.get(prefix);
        if (uri == null
                && !StructuralAttributes.STRUCTURES_PREFIX.equals(prefix)
                && !StructuralAttributes.XSI_PREFIX.equals(prefix)) {
            throw new DocumentParseException("Unresolved namespace prefix '" + prefix + "'", path + "/" + key);
        }
        return new QualifiedName(uri, prefix, local);
    }

    private static ElementNode convertObject(ObjectNode obj, QualifiedName name, Map<String, String> context, String path, int depth) {
        if (depth > MAX_DEPTH) {
            throw new DocumentParseException("Document nesting exceeds " + MAX_DEPTH + " levels", path);
        }
        ElementNode.Builder b = ElementNode.builder(name);

        boolean hasContent = false;
        String atId = null;
        Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            JsonNode value = e.getValue();
            if (key.startsWith("@")) {
                switch (key) {
                    case "@id":
                        if (!value.isValueNode() || value.isNull()) {
                            throw new DocumentParseException("@id must be a scalar", path + "/@id");
                        }
                        atId = value.asText();
                        break;
                    case "@value":
                        if (!value.isNull()) {
                            b.text(scalarText(value));
                            hasContent = true;
                        }
                        break;
                    default:
                        // @context, @type and other JSON-LD keywords carry no element content
                        break;
                }
                continue;
            }

            QualifiedName qn = resolve(key, context, path);
            if (value.isValueNode() && !value.isNull() && qn.localNameStartsLowerCase()) {
                b.attribute(qn, scalarText(value));
                hasContent |= isPlainAttribute(qn);
                continue;
            }
            if (value.isArray() && qn.localNameStartsLowerCase() && allScalars(value)) {
                // IDREFS style lists such as "nc:metadataRef": ["MD01", "PMD01"]
                b.attribute(qn, String.join(" ", scalars(value)));
                hasContent |= isPlainAttribute(qn);
                continue;
            }
            if (value.isArray()) {
                for (JsonNode item : value) {
                    if (item.isArray()) {
                        throw new DocumentParseException("Nested arrays are not supported", path + "/" + key);
                    }
                    b.child(convertValue(item, qn, context, path + "/" + key, depth + 1));
                    hasContent = true;
                }
                continue;
            }
            b.child(convertValue(value, qn, context, path + "/" + key, depth + 1));
            hasContent = true;
        }

        if (atId != null) {
            if (!hasContent) {
                b.reference(atId);
                b.nil(true);
            } else if (atId.startsWith("#")) {
                b.uri(atId);
            } else {
                b.declaredId(atId);
            }
        }
        return b.build();
    }

    /** Attribute that becomes a node property, which makes its object content rather than a bare reference. */
    private static boolean isPlainAttribute(QualifiedName qn) {
        return !StructuralAttributes.isStructures(qn)
                && !StructuralAttributes.isXsi(qn)
                && !StructuralAttributes.isMetadataReference(qn);
    }

    private static ElementNode convertValue(JsonNode value, QualifiedName name, Map<String, String> context, String path, int depth) {
        if (value.isObject()) {
            return convertObject((ObjectNode) value, name, context, path, depth);
        }
        ElementNode.Builder b = ElementNode.builder(name);
        if (value.isNull()) {
            b.nil(true);
        } else {
            b.text(scalarText(value));
        }
        return b.build();
    }

    private static String scalarText(JsonNode v) {
        if (v.isBigDecimal()) {
            return v.decimalValue().toPlainString();
        }
        return v.asText();
    }

    private static boolean allScalars(JsonNode array) {
        for (JsonNode item : array) {
            if (!item.isValueNode() || item.isNull()) return false;
        }
        return true;
    }

    private static List<String> scalars(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode item : array) out.add(scalarText(item));
        return out;
    }
}
