package info.isaksson.erland.niemtograph.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads mapping tables from YAML or JSON.
 *
 * <p>Two layouts are accepted. The compact one maps type names to rules:</p>
 * <pre>
 * types:
 *   nc:Person: node
 *   nc:PersonName: flatten
 *   j:PersonChargeAssociation: {kind: association, label: CHARGED_WITH}
 * </pre>
 * <p>The schema-derived one lists objects and associations the way a schema import produces them:</p>
 * <pre>
 * objects:
 *   - qname: nc:Person
 *     label: nc_Person
 * associations:
 *   - qname: j:PersonChargeAssociation
 *     rel_type: CHARGED_WITH
 * augmentations:
 *   - qname: j:ChargeAugmentation
 * flatten:
 *   - nc:PersonName
 * </pre>
 */
public final class MappingTableLoader {

    private MappingTableLoader() {}

    public static MappingTable load(Path file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, isJson(file));
        }
    }

    public static MappingTable load(InputStream in, boolean json) throws IOException {
        ObjectMapper om = json ? new ObjectMapper() : new ObjectMapper(new YAMLFactory());
        JsonNode root = om.readTree(in);
        return fromTree(root);
    }

    public static MappingTable fromTree(JsonNode root) {
        Map<String, TypeRule> rules = new LinkedHashMap<>();
        if (root == null || root.isNull() || root.isMissingNode()) return MappingTable.empty();
        if (!root.isObject()) throw new IllegalArgumentException("mapping root must be an object");

        JsonNode types = root.get("types");
        if (types != null && types.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = types.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                rules.put(e.getKey(), compactRule(e.getKey(), e.getValue()));
            }
        }
        listed(root.get("objects"), RuleKind.NODE, "label", rules);
        listed(root.get("associations"), RuleKind.ASSOCIATION, "rel_type", rules);
        listed(root.get("augmentations"), RuleKind.AUGMENTATION, null, rules);
        listed(root.get("flatten"), RuleKind.FLATTEN, null, rules);
        return new MappingTable(rules);
    }

    private static TypeRule compactRule(String typeName, JsonNode v) {
        if (v.isTextual()) return TypeRule.of(RuleKind.parse(v.asText()));
        if (v.isObject() && v.hasNonNull("kind")) {
            return new TypeRule(RuleKind.parse(v.get("kind").asText()), text(v, "label"));
        }
        throw new IllegalArgumentException("Invalid mapping rule for " + typeName + ": " + v);
    }

    private static void listed(JsonNode list, RuleKind kind, String labelField, Map<String, TypeRule> out) {
        if (list == null || list.isNull()) return;
        if (!list.isArray()) throw new IllegalArgumentException("mapping section for " + kind + " must be a list");
        for (JsonNode item : list) {
            if (item.isTextual()) {
                out.put(item.asText(), TypeRule.of(kind));
                continue;
            }
            String qname = text(item, "qname");
            if (qname == null) throw new IllegalArgumentException("mapping entry without qname: " + item);
            out.put(qname, new TypeRule(kind, labelField == null ? null : text(item, labelField)));
        }
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static boolean isJson(Path p) {
        return p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
