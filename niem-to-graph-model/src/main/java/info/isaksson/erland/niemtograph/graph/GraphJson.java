package info.isaksson.erland.niemtograph.graph;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for {@link GraphModel}.
 *
 * <p>Writing is deterministic: the model is normalized first and map keys are emitted in sorted order.</p>
 */
public final class GraphJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private GraphJson() {}

    public static GraphModel read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, GraphModel.class);
        }
    }

    public static GraphModel readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, GraphModel.class);
    }

    public static void write(GraphModel model, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        GraphModel normalized = GraphNormalizer.normalize(model);
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, normalized);
            // Trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(GraphModel model) throws IOException {
        GraphModel normalized = GraphNormalizer.normalize(model);
        return MAPPER.writer(PRETTY).writeValueAsString(normalized) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
