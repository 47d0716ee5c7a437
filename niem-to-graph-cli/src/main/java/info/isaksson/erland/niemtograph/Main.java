package info.isaksson.erland.niemtograph;

import info.isaksson.erland.niemtograph.convert.ConversionConfigLoader;
import info.isaksson.erland.niemtograph.convert.ConversionMode;
import info.isaksson.erland.niemtograph.convert.ConversionWarning;
import info.isaksson.erland.niemtograph.core.BatchResult;
import info.isaksson.erland.niemtograph.core.NiemToGraphOptions;
import info.isaksson.erland.niemtograph.core.NiemToGraphResult;
import info.isaksson.erland.niemtograph.core.NiemToGraphService;
import info.isaksson.erland.niemtograph.cypher.CypherWriter;
import info.isaksson.erland.niemtograph.document.DocumentFormat;
import info.isaksson.erland.niemtograph.error.ConversionException;
import info.isaksson.erland.niemtograph.graph.GraphJson;
import info.isaksson.erland.niemtograph.io.DocumentScanner;
import info.isaksson.erland.niemtograph.mapping.MappingTableLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CLI entrypoint: NIEM XML/JSON documents in, graph JSON and Cypher scripts out.
 *
 * <p>Exit codes: 0 success, 1 usage error, 2 conversion failure, 3 warnings present while
 * {@code --fail-on-warnings} is set.</p>
 */
public final class Main {

    static final String GRAPH_JSON = "graph.json";
    static final String GRAPH_CYPHER = "graph.cypher";

    private static final NiemToGraphService SERVICE = new NiemToGraphService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.inputs.isEmpty()) {
            System.err.println("Error: --input is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final NiemToGraphOptions opts;
        try {
            opts = toCoreOptions(parsed);
            // rejects inconsistent settings before any document is read
            opts.toConfig();
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            return 1;
        } catch (IOException ex) {
            System.err.println("Error: could not read configuration.");
            System.err.println(ex.getMessage());
            return 1;
        }

        final Map<Path, String> documents;
        try {
            documents = collectDocuments(parsed);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            return 1;
        } catch (IOException ex) {
            System.err.println("Error: could not scan input.");
            System.err.println(ex.getMessage());
            return 2;
        }
        if (documents.isEmpty()) {
            System.err.println("Error: no .xml or .json documents found in the given input.");
            return 1;
        }

        final Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();

        final BatchResult batch;
        try {
            batch = SERVICE.convertBatch(new ArrayList<>(documents.keySet()), opts);
        } catch (ConversionException ex) {
            System.err.println("Error: conversion failed: " + describe(ex));
            return 2;
        } catch (RuntimeException ex) {
            System.err.println("Error: conversion failed.");
            System.err.println(ex.getMessage());
            return 2;
        }

        int warnings = 0;
        int written = 0;
        try {
            if (batch.isShared()) {
                writeGraph(batch.merged, outDir);
                warnings += printWarnings(batch.merged);
                written++;
            } else {
                boolean single = documents.size() == 1 && !parsed.anyDirectoryInput;
                Set<String> usedDirs = new HashSet<>();
                for (BatchResult.DocumentOutcome d : batch.documents) {
                    if (!d.succeeded()) continue;
                    Path target = single ? outDir : outDir.resolve(uniqueDirName(documents.get(d.source), usedDirs));
                    writeGraph(d.result, target);
                    warnings += printWarnings(d.result);
                    written++;
                }
            }
        } catch (IOException ex) {
            System.err.println("Error: could not write output to: " + outDir);
            System.err.println(ex.getMessage());
            return 2;
        }

        for (BatchResult.DocumentOutcome d : batch.failures()) {
            System.err.println("Error: " + d.source + ": " + describe(d.failure));
        }

        System.out.println(
                "niem-to-graph" + (batch.isShared() ? " (shared namespace)" : "") + "\n" +
                "- Documents: " + documents.size() + "\n" +
                "- Converted: " + (documents.size() - batch.failures().size()) + "\n" +
                "- Failed: " + batch.failures().size() + "\n" +
                "- Graphs written: " + written + "\n" +
                "- Warnings: " + warnings + "\n" +
                "- Output: " + outDir
        );

        if (!batch.failures().isEmpty()) {
            return 2;
        }
        if (parsed.failOnWarnings && warnings > 0) {
            System.err.println("Warnings present (" + warnings + ") and --fail-on-warnings is set.");
            return 3;
        }
        return 0;
    }

    static NiemToGraphOptions toCoreOptions(CliArgs parsed) throws IOException {
        NiemToGraphOptions o = parsed.config == null
                ? new NiemToGraphOptions()
                : NiemToGraphOptions.from(ConversionConfigLoader.load(existingFile(parsed.config, "--config")));

        o.format = parsed.format;
        o.rootName = parsed.root;
        if (parsed.mapping != null) {
            o.mappingTable = MappingTableLoader.load(existingFile(parsed.mapping, "--mapping"));
            if (parsed.mode == null) o.mode = ConversionMode.MAPPING;
        }
        if (parsed.mode != null) o.mode = parsed.mode;
        if (parsed.strictMapping != null) o.strictMapping = parsed.strictMapping;
        if (parsed.strictReferences != null) o.strictReferences = parsed.strictReferences;
        if (parsed.hubLabel != null) o.hubLabel = parsed.hubLabel;
        if (parsed.threads != null) o.threads = parsed.threads;
        o.sharedNamespace = parsed.sharedNamespace;
        return o;
    }

    /** Documents to convert, in input order, each with the name its output folder is derived from. */
    private static Map<Path, String> collectDocuments(CliArgs parsed) throws IOException {
        Map<Path, String> out = new LinkedHashMap<>();
        for (String in : parsed.inputs) {
            Path p = Paths.get(in).toAbsolutePath().normalize();
            if (!Files.exists(p)) {
                throw new IllegalArgumentException("--input does not exist: " + p);
            }
            if (Files.isDirectory(p)) {
                parsed.anyDirectoryInput = true;
                for (Path f : DocumentScanner.scan(p, parsed.excludes)) {
                    out.putIfAbsent(f, p.relativize(f).toString().replace('\\', '/'));
                }
            } else {
                out.putIfAbsent(p, p.getFileName().toString());
            }
        }
        return out;
    }

    private static Path existingFile(String arg, String flag) {
        Path p = Paths.get(arg).toAbsolutePath().normalize();
        if (!Files.isRegularFile(p)) {
            throw new IllegalArgumentException(flag + " must point to an existing file: " + p);
        }
        return p;
    }

    private static void writeGraph(NiemToGraphResult result, Path dir) throws IOException {
        Files.createDirectories(dir);
        GraphJson.write(result.graph, dir.resolve(GRAPH_JSON));
        CypherWriter.write(result.graph, dir.resolve(GRAPH_CYPHER));
    }

    private static int printWarnings(NiemToGraphResult result) {
        for (ConversionWarning w : result.warnings) {
            System.err.println("Warning: " + result.sourceName + ": [" + w.code + "] "
                    + (w.elementPath == null ? "" : w.elementPath + ": ") + w.message);
        }
        return result.warnings.size();
    }

    /** Output folder for a document name relative to its input; a repeated name gets a numeric suffix. */
    static String uniqueDirName(String name, Set<String> used) {
        String base = name.replace(':', '_');
        String candidate = base;
        for (int i = 2; !used.add(candidate.toLowerCase(Locale.ROOT)); i++) {
            candidate = base + "-" + i;
        }
        return candidate;
    }

    private static String describe(Exception ex) {
        if (ex instanceof ConversionException) {
            ConversionException ce = (ConversionException) ex;
            return "[" + ce.getCode() + "] " + ce.getMessage()
                    + (ce.getElementPath() == null ? "" : " at " + ce.getElementPath());
        }
        return ex.getMessage();
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        final List<String> inputs = new ArrayList<>();
        String output = "./output";
        final List<String> excludes = new ArrayList<>();

        // null: keep the configured or default value
        DocumentFormat format;
        String root;
        ConversionMode mode;
        String mapping;
        String config;
        Boolean strictMapping;
        Boolean strictReferences;
        String hubLabel;
        Integer threads;

        boolean sharedNamespace = false;
        boolean failOnWarnings = false;

        boolean anyDirectoryInput = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--input":
                        out.inputs.add(requireValue(args, ++i, "--input"));
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--format":
                        out.format = DocumentFormat.parseCli(requireValue(args, ++i, "--format"));
                        break;
                    case "--root":
                        out.root = requireValue(args, ++i, "--root");
                        break;
                    case "--mode":
                        out.mode = ConversionMode.parseCli(requireValue(args, ++i, "--mode"));
                        break;
                    case "--mapping":
                        out.mapping = requireValue(args, ++i, "--mapping");
                        break;
                    case "--config":
                        out.config = requireValue(args, ++i, "--config");
                        break;
                    case "--strict-mapping":
                        out.strictMapping = parseBoolean(requireValue(args, ++i, "--strict-mapping"), "--strict-mapping");
                        break;
                    case "--strict-references":
                        out.strictReferences = parseBoolean(requireValue(args, ++i, "--strict-references"), "--strict-references");
                        break;
                    case "--hub-label":
                        out.hubLabel = requireValue(args, ++i, "--hub-label");
                        break;
                    case "--shared-namespace":
                        out.sharedNamespace = true;
                        break;
                    case "--threads":
                        out.threads = parsePositiveInt(requireValue(args, ++i, "--threads"), "--threads");
                        break;
                    case "--fail-on-warnings":
                        out.failOnWarnings = parseBoolean(requireValue(args, ++i, "--fail-on-warnings"), "--fail-on-warnings");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // a bare path is shorthand for --input
                        out.inputs.add(a);
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase(Locale.ROOT);
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static int parsePositiveInt(String v, String flag) {
            try {
                int n = Integer.parseInt(v.trim());
                if (n < 1) throw new IllegalArgumentException(flag + " must be at least 1: " + v);
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v, e);
            }
        }

        static void printHelp() {
            System.out.println(
                    "niem-to-graph\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar niem-to-graph.jar --input <file|dir> [--output <dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <path>              NIEM XML or JSON document, or a folder of them (repeatable, required)\n" +
                    "  --output <dir>              Output folder (default: ./output). Writes graph.json and graph.cypher,\n" +
                    "                              in one sub-folder per document when more than one is converted.\n" +
                    "  --exclude <glob>            Exclude paths matching glob when scanning a folder (repeatable).\n" +
                    "                              Matched against paths relative to the folder using '/' separators.\n" +
                    "                              Also supports --exclude=<glob>.\n" +
                    "  --format <fmt>              auto | xml | json (default: auto)\n" +
                    "  --root <qname>              Expected root element, e.g. exch:CrashDriverInfo\n" +
                    "  --mode <mode>               dynamic | mapping (default: dynamic; mapping when --mapping is given)\n" +
                    "  --mapping <file>            Mapping table (YAML or JSON)\n" +
                    "  --config <file>             Conversion config (YAML or JSON); the flags below override it\n" +
                    "  --strict-mapping <bool>     Fail on entity types without a mapping rule (default: false)\n" +
                    "  --strict-references <bool>  Fail on unresolved references (default: true)\n" +
                    "  --hub-label <label>         Node type of hub nodes (default: Entity)\n" +
                    "  --shared-namespace          Merge hubs and resolve references across all documents into one graph\n" +
                    "  --threads <n>               Worker threads for batch conversion (default: CPU count)\n" +
                    "  --fail-on-warnings <bool>   Exit with code 3 when warnings were reported (default: false)\n" +
                    "  -h, --help                  Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/niem-to-graph.jar --input samples/crash-driver/msg1.xml --output out\n" +
                    "  java -jar target/niem-to-graph.jar samples/crash-driver --mapping samples/mapping/crash.yaml\n" +
                    "  java -jar target/niem-to-graph.jar --input samples/shared --shared-namespace --strict-references false\n"
            );
        }
    }
}
