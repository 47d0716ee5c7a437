package info.isaksson.erland.niemtograph.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic discovery of exchange documents ({@code .xml}, {@code .json}, {@code .jsonld}) under a folder.
 *
 * The scanner returns a stable list sorted by relative path, so batch output does not depend on file system order.
 */
public final class DocumentScanner {

    private DocumentScanner() {}

    /**
     * @param root         folder to scan
     * @param excludeGlobs glob patterns matched against the path relative to {@code root}, using '/' separators
     */
    public static List<Path> scan(Path root, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(root, "root");
        if (Files.isRegularFile(root)) {
            return List.of(root);
        }

        final List<Predicate<Path>> excludes = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(DocumentScanner::isDocument)
                .filter(p -> !isHidden(root, p))
                .filter(p -> !matchesAny(root, p, excludes))
                .forEach(out::add);

            out.sort(Comparator.comparing(p -> normalizeRel(root, p)));
            return out;
        }
    }

    static boolean isDocument(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xml") || name.endsWith(".json") || name.endsWith(".jsonld");
    }

    private static boolean isHidden(Path root, Path p) {
        String rel = normalizeRel(root, p);
        return rel.startsWith(".") || rel.contains("/.");
    }

    private static boolean matchesAny(Path root, Path absolutePath, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        final Path rel = root.relativize(absolutePath);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim().replace("\\", "/");
            if (pattern.isEmpty()) continue;

            // A bare directory name excludes everything below it.
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[")
                    && !isDocument(Path.of(pattern))) {
                pattern = pattern.endsWith("/") ? pattern + "**" : pattern + "/**";
            }

            final var matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(p -> matcher.matches(Path.of(normalizePathString(p))));
        }
        return out;
    }

    private static String normalizeRel(Path root, Path p) {
        return normalizePathString(root.relativize(p));
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
