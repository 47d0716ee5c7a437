package info.isaksson.erland.niemtograph.core;

import info.isaksson.erland.niemtograph.convert.WarningCode;
import info.isaksson.erland.niemtograph.error.DanglingReferenceException;
import info.isaksson.erland.niemtograph.error.DocumentParseException;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BatchConversionTest {

    private final NiemToGraphService service = new NiemToGraphService();

    @Test
    void failuresStayWithTheirDocument() throws Exception {
        Path dir = Files.createTempDirectory("niem-batch-");
        List<Path> files = Fixtures.copy(dir, "shared-a.xml", "shared-b.xml", "broken.xml", "msg1.xml");

        NiemToGraphOptions options = new NiemToGraphOptions();
        options.threads = 3;
        BatchResult batch = service.convertBatch(files, options);

        assertFalse(batch.isShared());
        assertEquals(4, batch.documents.size());
        for (int i = 0; i < files.size(); i++) {
            assertEquals(files.get(i), batch.documents.get(i).source, "outcomes keep input order");
        }

        BatchResult.DocumentOutcome a = batch.documents.get(0);
        assertTrue(a.succeeded());
        assertEquals(4, a.result.graph.nodes.size());

        BatchResult.DocumentOutcome b = batch.documents.get(1);
        assertInstanceOf(DanglingReferenceException.class, b.failure, "P01 is declared in another file");
        assertNull(b.result);

        assertInstanceOf(DocumentParseException.class, batch.documents.get(2).failure);
        assertEquals(19, batch.documents.get(3).result.graph.nodes.size());
        assertEquals(2, batch.failures().size());
    }

    @Test
    void lenientReferencesTurnFailuresIntoWarnings() throws Exception {
        Path dir = Files.createTempDirectory("niem-batch-");
        List<Path> files = Fixtures.copy(dir, "shared-b.xml");

        NiemToGraphOptions options = new NiemToGraphOptions();
        options.strictReferences = false;
        BatchResult batch = service.convertBatch(files, options);

        NiemToGraphResult b = batch.documents.get(0).result;
        assertTrue(batch.hasWarnings());
        assertTrue(b.warnings.stream().anyMatch(w -> w.code == WarningCode.DANGLING_REFERENCE));
        assertTrue(b.warnings.stream().anyMatch(w -> w.code == WarningCode.ASSOCIATION_DEGRADED));
    }

    @Test
    void directoryScanHonoursExcludes() throws Exception {
        Path dir = Files.createTempDirectory("niem-batch-");
        Fixtures.copy(dir, "msg1.xml", "msg1.json", "broken.xml");
        Files.writeString(dir.resolve("notes.txt"), "not a document");

        BatchResult batch = service.convertDirectory(dir, List.of("broken.xml"), new NiemToGraphOptions());

        assertEquals(2, batch.documents.size());
        assertEquals(dir.resolve("msg1.json"), batch.documents.get(0).source);
        assertEquals(dir.resolve("msg1.xml"), batch.documents.get(1).source);
        assertTrue(batch.failures().isEmpty());
    }

    @Test
    void emptyBatch() {
        BatchResult batch = service.convertBatch(List.of(), null);
        assertTrue(batch.documents.isEmpty());
        assertFalse(batch.hasWarnings());
    }
}
