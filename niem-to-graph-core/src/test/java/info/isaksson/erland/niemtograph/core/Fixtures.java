package info.isaksson.erland.niemtograph.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Copies fixtures from {@code src/test/resources/fixtures} into a folder, so tests work on real files. */
final class Fixtures {
    private Fixtures() {}

    static byte[] bytes(String name) throws IOException {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("fixture must exist in test resources: " + name);
            return in.readAllBytes();
        }
    }

    static List<Path> copy(Path dir, String... names) throws IOException {
        List<Path> out = new ArrayList<>();
        for (String name : names) {
            Path target = dir.resolve(name);
            Files.createDirectories(target.getParent());
            Files.write(target, bytes(name));
            out.add(target);
        }
        return out;
    }
}
