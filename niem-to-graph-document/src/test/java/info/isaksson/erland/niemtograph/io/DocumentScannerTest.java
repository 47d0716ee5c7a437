package info.isaksson.erland.niemtograph.io;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DocumentScannerTest {

    @Test
    void scanIsSortedAndHonoursExcludes() throws Exception {
        Path root = Files.createTempDirectory("niem-scan-");
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("a/skip"));
        Files.createDirectories(root.resolve(".hidden"));
        Files.writeString(root.resolve("b/two.json"), "{}");
        Files.writeString(root.resolve("a/one.xml"), "<a/>");
        Files.writeString(root.resolve("a/skip/three.xml"), "<a/>");
        Files.writeString(root.resolve("a/notes.txt"), "x");
        Files.writeString(root.resolve(".hidden/four.xml"), "<a/>");

        List<String> found = DocumentScanner.scan(root, List.of("a/skip")).stream()
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .collect(Collectors.toList());

        assertEquals(List.of("a/one.xml", "b/two.json"), found);
    }

    @Test
    void singleFileIsReturnedAsIs() throws Exception {
        Path f = Files.createTempFile("niem-", ".xml");
        assertEquals(List.of(f), DocumentScanner.scan(f, null));
    }
}
