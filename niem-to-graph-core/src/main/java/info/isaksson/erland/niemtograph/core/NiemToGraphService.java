package info.isaksson.erland.niemtograph.core;

import info.isaksson.erland.niemtograph.convert.ConversionConfig;
import info.isaksson.erland.niemtograph.convert.ConversionResult;
import info.isaksson.erland.niemtograph.convert.DocumentPass;
import info.isaksson.erland.niemtograph.convert.GraphConverter;
import info.isaksson.erland.niemtograph.document.DocumentNormalizer;
import info.isaksson.erland.niemtograph.document.ParsedDocument;
import info.isaksson.erland.niemtograph.error.ConversionException;
import info.isaksson.erland.niemtograph.io.DocumentScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core (server-friendly) API for converting NIEM documents to property graphs.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline.
 * Instances hold no per-conversion state and may be shared between threads.</p>
 */
public final class NiemToGraphService {

    private static final Logger log = LoggerFactory.getLogger(NiemToGraphService.class);

    private final DocumentNormalizer normalizer = new DocumentNormalizer();
    private final GraphConverter converter = new GraphConverter();

    /**
     * Convert one document held in memory.
     *
     * @throws ConversionException on a fatal parse or conversion error
     */
    public NiemToGraphResult convert(byte[] content, String sourceName, NiemToGraphOptions options) {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        if (options == null) options = new NiemToGraphOptions();

        ParsedDocument doc = normalizer.normalize(content, options.format, options.rootName, sourceName);
        ConversionResult result = converter.convert(doc, options.toConfig());
        return new NiemToGraphResult(doc.sourceName, doc.fingerprint, result);
    }

    /** Convert one document file. */
    public NiemToGraphResult convert(Path file, NiemToGraphOptions options) throws IOException {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        if (options == null) options = new NiemToGraphOptions();

        ParsedDocument doc = normalizer.normalize(file, options.format, options.rootName);
        ConversionResult result = converter.convert(doc, options.toConfig());
        return new NiemToGraphResult(doc.sourceName, doc.fingerprint, result);
    }

    /** Convert every document found under a folder (or a single file). */
    public BatchResult convertDirectory(Path root, List<String> excludeGlobs, NiemToGraphOptions options) throws IOException {
        if (root == null) throw new IllegalArgumentException("root must not be null");
        List<Path> files = DocumentScanner.scan(root, excludeGlobs == null ? List.of() : excludeGlobs);
        return convertBatch(files, options);
    }

    /**
     * Convert a batch of documents in parallel.
     *
     * <p>A document that fails is reported in its {@link BatchResult.DocumentOutcome} and does not stop
     * the others. In shared-namespace mode the successful documents are merged into one graph.</p>
     *
     * @throws ConversionException in shared-namespace mode with strict references, when a reference
     *         is declared by no document of the batch
     */
    public BatchResult convertBatch(List<Path> files, NiemToGraphOptions options) {
        if (files == null) throw new IllegalArgumentException("files must not be null");
        if (options == null) options = new NiemToGraphOptions();
        final NiemToGraphOptions opts = options;
        final ConversionConfig config = opts.toConfig();

        List<Callable<Pass>> tasks = new ArrayList<>(files.size());
        for (Path file : files) {
            tasks.add(() -> runOne(file, opts, config));
        }
        List<Pass> passes = runAll(tasks, opts.threads);

        List<BatchResult.DocumentOutcome> outcomes = new ArrayList<>(passes.size());
        if (!opts.sharedNamespace) {
            for (Pass p : passes) {
                outcomes.add(new BatchResult.DocumentOutcome(p.file, p.result, p.failure));
            }
            log.info("Converted {} document(s), {} failed", passes.size(), countFailures(passes));
            return new BatchResult(outcomes, null);
        }

        List<DocumentPass> prepared = new ArrayList<>();
        for (Pass p : passes) {
            outcomes.add(new BatchResult.DocumentOutcome(p.file, null, p.failure));
            if (p.pass != null) prepared.add(p.pass);
        }
        ConversionResult merged = new SharedNamespaceReconciler(config).reconcile(prepared);
        log.info("Merged {} document(s) into {} nodes, {} edges; {} failed",
                prepared.size(), merged.graph.nodes.size(), merged.graph.edges.size(), countFailures(passes));
        return new BatchResult(outcomes, new NiemToGraphResult(SharedNamespaceReconciler.BATCH_SOURCE, null, merged));
    }

    private Pass runOne(Path file, NiemToGraphOptions opts, ConversionConfig config) {
        try {
            ParsedDocument doc = normalizer.normalize(file, opts.format, opts.rootName);
            if (opts.sharedNamespace) {
                return Pass.prepared(file, converter.prepare(doc, config));
            }
            ConversionResult r = converter.convert(doc, config);
            return Pass.converted(file, new NiemToGraphResult(doc.sourceName, doc.fingerprint, r));
        } catch (ConversionException e) {
            log.warn("Conversion of {} failed: {} at {}", file, e.getMessage(), e.getElementPath());
            return Pass.failed(file, e);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return Pass.failed(file, e);
        }
    }

    private static List<Pass> runAll(List<Callable<Pass>> tasks, int threads) {
        if (tasks.isEmpty()) return List.of();
        int n = Math.max(1, Math.min(threads, tasks.size()));
        ExecutorService pool = Executors.newFixedThreadPool(n, new WorkerThreadFactory());
        try {
            List<Future<Pass>> futures = pool.invokeAll(tasks);
            List<Pass> out = new ArrayList<>(futures.size());
            for (Future<Pass> f : futures) {
                out.add(f.get());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Batch conversion interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Batch conversion failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private static int countFailures(List<Pass> passes) {
        int n = 0;
        for (Pass p : passes) {
            if (p.failure != null) n++;
        }
        return n;
    }

    /** Result of one worker task. */
    private static final class Pass {
        final Path file;
        final NiemToGraphResult result;
        final DocumentPass pass;
        final Exception failure;

        private Pass(Path file, NiemToGraphResult result, DocumentPass pass, Exception failure) {
            this.file = file;
            this.result = result;
            this.pass = pass;
            this.failure = failure;
        }

        static Pass converted(Path file, NiemToGraphResult result) {
            return new Pass(file, result, null, null);
        }

        static Pass prepared(Path file, DocumentPass pass) {
            return new Pass(file, null, pass, null);
        }

        static Pass failed(Path file, Exception failure) {
            return new Pass(file, null, null, failure);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger next = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "niem-to-graph-worker-" + next.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
