package de.mirkosertic.docsearch;

import de.mirkosertic.docsearch.config.BuildInfo;
import de.mirkosertic.docsearch.crawler.CrawlExecutorService;
import de.mirkosertic.docsearch.crawler.DocumentIndexer;
import de.mirkosertic.docsearch.crawler.FileEnumerator;
import de.mirkosertic.docsearch.crawler.FileFingerprint;
import de.mirkosertic.docsearch.crawler.FingerprintDiff;
import de.mirkosertic.docsearch.crawler.FingerprintStore;
import de.mirkosertic.docsearch.extraction.ExtractedDocument;
import de.mirkosertic.docsearch.extraction.ExtractionCache;
import de.mirkosertic.docsearch.extraction.ExtractionException;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.MultiTerms;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;

/**
 * Owns the on-disk index and its two write paths.
 * <p>
 * A full rebuild deletes the index directory and writes every extracted page through a single
 * {@link IndexWriter}. An incremental update diffs the current file fingerprints against the
 * snapshot of the last run and only touches changed and deleted paths. Both run extraction on
 * the crawl pool, write on the calling thread, record the schema version in the commit, and
 * invalidate the {@link CachedIndexHandle} before returning. Calls are serialized per instance.
 */
public class LuceneIndexService {

    private static final Logger logger = LoggerFactory.getLogger(LuceneIndexService.class);

    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String SOFTWARE_VERSION_KEY = "software_version";

    private static final double RAM_BUFFER_SIZE_MB = 128.0;

    public enum Mode {
        REBUILD,
        UPDATE
    }

    /**
     * Outcome of a successful rebuild or update.
     */
    public record IndexingResult(Mode mode, int filesFound, int filesIndexed, int filesFailed,
                                 int filesDeleted, int filesUnchanged, long documentsWritten, long elapsedMs) {
    }

    private record FileExtraction(Path file, @Nullable FileFingerprint fingerprint,
                                  @Nullable ExtractedDocument document, @Nullable String error) {
    }

    @FunctionalInterface
    private interface ExtractionSink {
        void accept(FileExtraction extraction) throws IOException;
    }

    private static final class RunStats {
        int indexed;
        int failed;
        long documents;
    }

    private final Path indexPath;
    private final ExtractionCache extractionCache;
    private final FingerprintStore fingerprintStore;
    private final FileEnumerator fileEnumerator;
    private final DocumentIndexer documentIndexer;
    private final CrawlExecutorService executor;
    private final CachedIndexHandle indexHandle;
    private final int cacheMaxPages;
    private final StandardAnalyzer analyzer = new StandardAnalyzer();

    public LuceneIndexService(final Path indexPath,
                              final ExtractionCache extractionCache,
                              final FingerprintStore fingerprintStore,
                              final FileEnumerator fileEnumerator,
                              final DocumentIndexer documentIndexer,
                              final CrawlExecutorService executor,
                              final CachedIndexHandle indexHandle,
                              final int cacheMaxPages) {
        this.indexPath = indexPath;
        this.extractionCache = extractionCache;
        this.fingerprintStore = fingerprintStore;
        this.fileEnumerator = fileEnumerator;
        this.documentIndexer = documentIndexer;
        this.executor = executor;
        this.indexHandle = indexHandle;
        this.cacheMaxPages = cacheMaxPages;
    }

    public Path getIndexPath() {
        return indexPath;
    }

    public boolean indexExists() {
        if (!Files.isDirectory(indexPath)) {
            return false;
        }
        try (final Directory directory = FSDirectory.open(indexPath)) {
            return DirectoryReader.indexExists(directory);
        } catch (final IOException e) {
            logger.warn("Cannot open index at {}", indexPath, e);
            return false;
        }
    }

    /**
     * True when no index exists or its schema version differs from {@link DocumentIndexer#SCHEMA_VERSION}.
     */
    public boolean isRebuildRequired() {
        if (!Files.isDirectory(indexPath)) {
            return true;
        }
        try (final Directory directory = FSDirectory.open(indexPath)) {
            if (!DirectoryReader.indexExists(directory)) {
                return true;
            }
            final Map<String, String> userData = SegmentInfos.readLatestCommit(directory).getUserData();
            final String storedVersion = userData.get(SCHEMA_VERSION_KEY);
            if (storedVersion == null) {
                logger.info("Index has no schema version, rebuild required");
                return true;
            }
            final int version = Integer.parseInt(storedVersion);
            if (version != DocumentIndexer.SCHEMA_VERSION) {
                logger.info("Index schema version {} differs from current version {}, rebuild required",
                        version, DocumentIndexer.SCHEMA_VERSION);
                return true;
            }
            return false;
        } catch (final IOException | NumberFormatException e) {
            logger.warn("Cannot read index metadata at {}, rebuild required", indexPath, e);
            return true;
        }
    }

    /**
     * Delete the index and rebuild it from every file below the watched folders.
     */
    public synchronized IndexingResult rebuild(final List<String> watchedFolders) throws IOException {
        final long startTime = System.currentTimeMillis();
        logger.info("Starting full index rebuild of {} folder(s) with {} extraction threads",
                watchedFolders.size(), executor.getThreads());

        indexHandle.invalidate();
        deleteRecursively(indexPath);
        Files.createDirectories(indexPath);

        final List<Path> files = fileEnumerator.enumerate(watchedFolders);
        final List<FileFingerprint> snapshot = new ArrayList<>();
        final RunStats stats = new RunStats();

        try (final Directory directory = FSDirectory.open(indexPath);
             final IndexWriter writer = new IndexWriter(directory, writerConfig(IndexWriterConfig.OpenMode.CREATE))) {

            extractAll(files, extraction -> {
                if (extraction.document() != null && extraction.fingerprint() != null) {
                    stats.documents += documentIndexer.addDocuments(writer, extraction.document());
                    stats.indexed++;
                    snapshot.add(extraction.fingerprint());
                } else {
                    stats.failed++;
                }
            });

            commit(writer);
        } finally {
            indexHandle.invalidate();
        }

        // Failed files stay out of the snapshot so the next update retries them
        fingerprintStore.save(snapshot);

        final IndexingResult result = new IndexingResult(Mode.REBUILD, files.size(), stats.indexed, stats.failed,
                0, 0, stats.documents, System.currentTimeMillis() - startTime);
        logger.info("Index rebuild finished: {}", result);
        return result;
    }

    /**
     * Bring the index in line with the watched folders, touching only changed and deleted files.
     * Falls back to {@link #rebuild(List)} when no usable index exists.
     * <p>
     * A changed file whose extraction fails keeps its previous pages and its previous fingerprint,
     * so it stays searchable and is retried by the next update.
     * <p>
     * Deletions cover the paths stored in the index as well as the snapshot, so rows of removed
     * files are dropped even when the snapshot is missing or older than the last commit.
     */
    public synchronized IndexingResult update(final List<String> watchedFolders) throws IOException {
        if (isRebuildRequired()) {
            logger.info("No usable index at {}, running full rebuild", indexPath);
            return rebuild(watchedFolders);
        }

        final long startTime = System.currentTimeMillis();
        final Map<String, FileFingerprint> previous = fingerprintStore.load();
        final List<Path> files = fileEnumerator.enumerate(watchedFolders);

        final List<FileFingerprint> current = new ArrayList<>();
        for (final Path file : files) {
            try {
                current.add(FileFingerprint.of(file));
            } catch (final IOException e) {
                logger.warn("Cannot fingerprint {}, skipping: {}", file, e.getMessage());
            }
        }

        final FingerprintDiff diff = FingerprintDiff.compute(previous, current);

        final Set<String> currentPaths = new HashSet<>();
        for (final FileFingerprint fingerprint : current) {
            currentPaths.add(fingerprint.path());
        }
        final Set<String> deleted = new TreeSet<>(diff.deleted());
        for (final String indexedPath : indexedPaths()) {
            if (!currentPaths.contains(indexedPath) && deleted.add(indexedPath)) {
                logger.debug("Indexed path {} is missing from the snapshot and the folders, deleting", indexedPath);
            }
        }

        logger.info("Incremental update: changed={}, deleted={}, unchanged={}",
                diff.changed().size(), deleted.size(), diff.unchangedCount());

        if (diff.changed().isEmpty() && deleted.isEmpty()) {
            return new IndexingResult(Mode.UPDATE, files.size(), 0, 0, 0, diff.unchangedCount(), 0,
                    System.currentTimeMillis() - startTime);
        }

        final Map<String, FileFingerprint> next = new HashMap<>(previous);
        final RunStats stats = new RunStats();

        try (final Directory directory = FSDirectory.open(indexPath);
             final IndexWriter writer = new IndexWriter(directory,
                     writerConfig(IndexWriterConfig.OpenMode.CREATE_OR_APPEND))) {

            for (final String deletedPath : deleted) {
                documentIndexer.deleteDocuments(writer, deletedPath);
                next.remove(deletedPath);
            }

            final List<Path> changedFiles = new ArrayList<>();
            for (final String changedPath : diff.changed().keySet()) {
                changedFiles.add(Paths.get(changedPath));
            }

            extractAll(changedFiles, extraction -> {
                if (extraction.document() != null && extraction.fingerprint() != null) {
                    stats.documents += documentIndexer.replaceDocuments(writer, extraction.document());
                    stats.indexed++;
                    next.put(extraction.fingerprint().path(), extraction.fingerprint());
                } else {
                    // previous pages and fingerprint stay in place
                    stats.failed++;
                }
            });

            commit(writer);
        } finally {
            indexHandle.invalidate();
        }

        fingerprintStore.save(next.values());

        final IndexingResult result = new IndexingResult(Mode.UPDATE, files.size(), stats.indexed, stats.failed,
                deleted.size(), diff.unchangedCount(), stats.documents,
                System.currentTimeMillis() - startTime);
        logger.info("Incremental update finished: {}", result);
        return result;
    }

    /**
     * Every distinct value of the path field in the committed index.
     */
    private Set<String> indexedPaths() throws IOException {
        final Set<String> paths = new HashSet<>();
        try (final Directory directory = FSDirectory.open(indexPath);
             final DirectoryReader reader = DirectoryReader.open(directory)) {
            final Terms terms = MultiTerms.getTerms(reader, DocumentIndexer.FIELD_PATH);
            if (terms == null) {
                return paths;
            }
            final TermsEnum termsEnum = terms.iterator();
            BytesRef term;
            while ((term = termsEnum.next()) != null) {
                paths.add(term.utf8ToString());
            }
        }
        return paths;
    }

    private IndexWriterConfig writerConfig(final IndexWriterConfig.OpenMode openMode) {
        final IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(openMode);
        config.setRAMBufferSizeMB(RAM_BUFFER_SIZE_MB);
        return config;
    }

    private void commit(final IndexWriter writer) throws IOException {
        writer.setLiveCommitData(Map.of(
                SCHEMA_VERSION_KEY, String.valueOf(DocumentIndexer.SCHEMA_VERSION),
                SOFTWARE_VERSION_KEY, BuildInfo.getVersion()
        ).entrySet());
        writer.commit();
    }

    /**
     * Extract the files on the crawl pool and hand each result to {@code sink} on this thread,
     * in completion order.
     */
    private void extractAll(final List<Path> files, final ExtractionSink sink) throws IOException {
        if (files.isEmpty()) {
            return;
        }
        final CompletionService<FileExtraction> completionService = executor.newCompletionService();
        for (final Path file : files) {
            completionService.submit(() -> extractOne(file));
        }

        for (int i = 0; i < files.size(); i++) {
            final FileExtraction extraction;
            try {
                extraction = completionService.take().get();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for extraction results");
            } catch (final ExecutionException e) {
                throw new IOException("Extraction task failed", e.getCause());
            }
            if (extraction.document() == null) {
                logger.warn("Skipping {}: {}", extraction.file(), extraction.error());
            }
            sink.accept(extraction);
        }
    }

    private FileExtraction extractOne(final Path file) {
        try {
            final FileFingerprint fingerprint = FileFingerprint.of(file);
            final ExtractedDocument document = extractionCache.getOrExtract(file, cacheMaxPages);
            return new FileExtraction(file, fingerprint, document, null);
        } catch (final IOException | ExtractionException | RuntimeException e) {
            return new FileExtraction(file, null, null, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    static void deleteRecursively(final Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path dir, final IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
