package com.dcruver.organizer.domain;

import com.dcruver.organizer.io.ArtifactStore;
import com.dcruver.organizer.io.ContentIdentity;
import com.dcruver.organizer.io.FileSampler;
import com.dcruver.organizer.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Walks the configured roots and turns every regular file into a {@link Document}.
 *
 * Discovery is synchronous; extraction (digest, sample, hints) runs on a fixed pool
 * and results are collected in discovery order once every task has finished.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FileScanner {

    private final ContentIdentity contentIdentity;
    private final FileSampler fileSampler;
    private final DocumentStore documentStore;
    private final ArtifactStore artifactStore;

    /**
     * Scan, upsert into the document store and write the snapshot export.
     */
    public ScanResult scanAndStore(ScanConfig config, Path snapshotPath) throws IOException {
        ScanResult result = scan(config);
        documentStore.upsertAll(result.getDocuments());
        artifactStore.writeSnapshot(snapshotPath, result.getDocuments());
        return result;
    }

    public ScanResult scan(ScanConfig config) throws IOException {
        List<Path> missingRoots = new ArrayList<>();
        List<Path> files = new ArrayList<>();
        int[] walkFailures = {0};

        for (Path configured : config.getPaths()) {
            Path root = expandHome(configured).toAbsolutePath().normalize();
            if (!Files.exists(root)) {
                log.warn("Scan root does not exist, skipping: {}", root);
                missingRoots.add(root);
                continue;
            }
            log.info("Scanning {}", root);
            discover(root, config, files, walkFailures);
        }
        log.info("Discovered {} files", files.size());

        List<Document> documents = new ArrayList<>();
        int oversize = 0;
        int failed = walkFailures[0];

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, config.getThreads()));
        try {
            List<Future<Extraction>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> extract(file, config)));
            }

            for (Future<Extraction> future : futures) {
                Extraction extraction = await(future);
                switch (extraction.outcome()) {
                    case SCANNED -> documents.add(extraction.document());
                    case OVERSIZE -> oversize++;
                    case FAILED -> failed++;
                }
            }
        } finally {
            pool.shutdown();
        }

        log.info("Scanned {} documents ({} oversize, {} failed, {} missing roots)",
            documents.size(), oversize, failed, missingRoots.size());

        return ScanResult.builder()
            .documents(List.copyOf(documents))
            .missingRoots(List.copyOf(missingRoots))
            .discovered(files.size())
            .skippedOversize(oversize)
            .failed(failed)
            .build();
    }

    private void discover(Path root, ScanConfig config, List<Path> files, int[] failures) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && config.getExcludeDirs().contains(dir.getFileName().toString())) {
                    log.debug("Excluding directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot access {}: {}", file, e.getMessage());
                failures[0]++;
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private Extraction extract(Path file, ScanConfig config) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            if (attrs.size() > config.getMaxSizeBytes()) {
                log.debug("Skipping oversize file {} ({} bytes)", file, attrs.size());
                return new Extraction(Outcome.OVERSIZE, null);
            }

            String digest = contentIdentity.digest(file);
            String docId = contentIdentity.deriveId(file, digest);
            String sample = fileSampler.readSample(file, config.getSampleBytes());

            String name = file.getFileName().toString();
            String extension = extensionOf(name);
            Path parent = file.getParent();
            String dirHint = parent != null && parent.getFileName() != null
                ? parent.getFileName().toString()
                : "";

            Document doc = Document.builder()
                .docId(docId)
                .path(ContentIdentity.normalizePath(file))
                .name(name)
                .extension(extension)
                .size(attrs.size())
                .modifiedTime(attrs.lastModifiedTime().toMillis() / 1000.0)
                .contentDigest(digest)
                .mimeType(fileSampler.detectMimeType(file))
                .dirHint(dirHint)
                .importsFirst(fileSampler.extractImports(sample))
                .topComment(fileSampler.extractTopComment(sample))
                .markdownHeadings(fileSampler.extractMarkdownHeadings(sample))
                .jsonRootKeys(fileSampler.extractJsonRootKeys(sample))
                .csvHeader(extension.equals("csv") ? fileSampler.extractCsvHeader(file) : List.of())
                .sampleText(sample)
                .build();
            return new Extraction(Outcome.SCANNED, doc);
        } catch (IOException e) {
            log.warn("Failed to scan {}: {}", file, e.getMessage());
            return new Extraction(Outcome.FAILED, null);
        }
    }

    private Extraction await(Future<Extraction> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Scan interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scan worker failed", e.getCause());
        }
    }

    /**
     * Lowercase extension without the dot, empty when there is none.
     */
    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static Path expandHome(Path path) {
        String raw = path.toString();
        if (raw.equals("~") || raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + raw.substring(1));
        }
        return path;
    }

    private enum Outcome { SCANNED, OVERSIZE, FAILED }

    private record Extraction(Outcome outcome, Document document) {}
}
