package info.isaksson.erland.niemtograph.convert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import info.isaksson.erland.niemtograph.mapping.MappingTableLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads a {@link ConversionConfig} from YAML or JSON.
 *
 * <pre>
 * mode: mapping
 * strictReferences: false
 * strictMapping: true
 * hubLabel: Entity
 * mapping: mappings/crash.yaml   # relative to the config file
 * </pre>
 *
 * Missing keys keep their defaults. An inline {@code mappingTable} object is accepted instead of {@code mapping}.
 */
public final class ConversionConfigLoader {

    private ConversionConfigLoader() {}

    public static ConversionConfig load(Path file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        try (InputStream in = Files.newInputStream(file)) {
            ObjectMapper om = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                    ? new ObjectMapper()
                    : new ObjectMapper(new YAMLFactory());
            Path base = file.toAbsolutePath().getParent();
            return fromTree(om.readTree(in), base).build();
        }
    }

    /** Applies the keys present in {@code root} onto a default builder. */
    static ConversionConfig.Builder fromTree(JsonNode root, Path base) throws IOException {
        ConversionConfig.Builder b = ConversionConfig.builder();
        if (root == null || root.isNull() || root.isMissingNode()) return b;
        if (!root.isObject()) throw new IllegalArgumentException("config root must be an object");

        if (root.hasNonNull("mode")) b.mode(ConversionMode.parseCli(root.get("mode").asText()));
        if (root.hasNonNull("strictReferences")) b.strictReferences(root.get("strictReferences").asBoolean());
        if (root.hasNonNull("strictMapping")) b.strictMapping(root.get("strictMapping").asBoolean());
        if (root.hasNonNull("hubLabel")) b.hubLabel(root.get("hubLabel").asText());
        if (root.hasNonNull("forwardReferences")) b.forwardReferences(root.get("forwardReferences").asBoolean());
        if (root.hasNonNull("tolerateNilReferences")) b.tolerateNilReferences(root.get("tolerateNilReferences").asBoolean());
        if (root.hasNonNull("augmentationSuffix")) b.augmentationSuffix(root.get("augmentationSuffix").asText());

        if (root.hasNonNull("mappingTable")) {
            b.mappingTable(MappingTableLoader.fromTree(root.get("mappingTable")));
        } else if (root.hasNonNull("mapping")) {
            Path p = Path.of(root.get("mapping").asText());
            if (!p.isAbsolute() && base != null) p = base.resolve(p);
            b.mappingTable(MappingTableLoader.load(p));
        }
        return b;
    }
}
