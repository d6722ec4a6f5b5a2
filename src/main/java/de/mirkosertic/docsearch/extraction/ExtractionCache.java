package de.mirkosertic.docsearch.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.hash.Hashing;
import de.mirkosertic.docsearch.crawler.FileFingerprint;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-through, fingerprint-keyed on-disk cache of extraction results.
 * <p>
 * Each entry lives in {@code doc_<16 hex digits>.json}, keyed by a SipHash of path,
 * modification time and size, and holds
 * {@code {title, path, pages: [[number, body], ...], mtime_secs, size, which}}.
 * A matching entry produced by the fallback tier is upgraded in place once the primary tier
 * is available. Eviction runs at most once per prune interval, before and after writes.
 */
public class ExtractionCache {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionCache.class);

    private final ContentExtractor extractor;
    private final Path cacheDirectory;
    private final long maxBytes;
    private final Duration maxAge;
    private final Duration pruneInterval;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong lastPruneMillis = new AtomicLong(0);

    public ExtractionCache(final ContentExtractor extractor, final Path cacheDirectory, final long maxBytes,
                           final Duration maxAge, final Duration pruneInterval) {
        this.extractor = extractor;
        this.cacheDirectory = cacheDirectory;
        this.maxBytes = maxBytes;
        this.maxAge = maxAge;
        this.pruneInterval = pruneInterval;
    }

    public Path getCacheDirectory() {
        return cacheDirectory;
    }

    /**
     * Return the cached extraction of {@code file}, extracting and storing it on a miss.
     *
     * @param maxPages pages kept from a fresh extraction
     * @throws IOException         if the file cannot be fingerprinted
     * @throws ExtractionException if no strategy could extract the file
     */
    public ExtractedDocument getOrExtract(final Path file, final int maxPages) throws IOException, ExtractionException {
        final FileFingerprint fingerprint = FileFingerprint.of(file);
        final Path entryFile = entryFile(fingerprint);

        final ExtractedDocument cached = read(entryFile, fingerprint);
        if (cached != null) {
            if (!ExtractorUpgradePolicy.shouldUpgrade(cached.extractor(), extractor.availableKinds(file))) {
                logger.debug("Extraction cache hit for {}", file);
                return cached;
            }

            final ExtractionOutcome upgrade = extractor.extractWith(ExtractorKind.PRIMARY, file);
            if (upgrade.document() == null) {
                logger.info("Upgrade of cached extraction for {} failed, keeping fallback result: {}",
                        file, upgrade.failureReason());
                return cached;
            }
            final ExtractedDocument upgraded = upgrade.document().truncate(maxPages);
            logger.info("Upgraded cached extraction for {} to the primary extractor", file);
            store(entryFile, fingerprint, upgraded);
            return upgraded;
        }

        final ExtractedDocument document = extractor.extract(file).orElseThrow().truncate(maxPages);
        store(entryFile, fingerprint, document);
        return document;
    }

    /**
     * Delete every cache entry. Returns the number of deleted entries.
     */
    public int clear() {
        if (!Files.isDirectory(cacheDirectory)) {
            return 0;
        }
        int deleted = 0;
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDirectory)) {
            for (final Path file : stream) {
                if (CachePruner.isManagedEntry(file)) {
                    try {
                        Files.deleteIfExists(file);
                        deleted++;
                    } catch (final IOException e) {
                        logger.warn("Failed to delete cache entry {}", file, e);
                    }
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to list extraction cache directory {}", cacheDirectory, e);
        }
        logger.info("Cleared {} extraction cache entries", deleted);
        return deleted;
    }

    /**
     * Run eviction now, ignoring the rate limit.
     */
    public CachePruner.PruneResult prune() {
        lastPruneMillis.set(System.currentTimeMillis());
        return CachePruner.prune(cacheDirectory, maxBytes, maxAge);
    }

    static String entryFileName(final FileFingerprint fingerprint) {
        final long key = Hashing.sipHash24().newHasher()
                .putString(fingerprint.path(), StandardCharsets.UTF_8)
                .putLong(fingerprint.mtimeSecs())
                .putLong(fingerprint.size())
                .hash()
                .asLong();
        return String.format(Locale.ROOT, "%s%016x%s", CachePruner.ENTRY_PREFIX, key, CachePruner.ENTRY_SUFFIX);
    }

    Path entryFile(final FileFingerprint fingerprint) {
        return cacheDirectory.resolve(entryFileName(fingerprint));
    }

    private @Nullable ExtractedDocument read(final Path entryFile, final FileFingerprint fingerprint) {
        if (!Files.isRegularFile(entryFile)) {
            return null;
        }
        try {
            final JsonNode root = objectMapper.readTree(entryFile.toFile());
            if (root == null
                    || root.path("mtime_secs").asLong(-1) != fingerprint.mtimeSecs()
                    || root.path("size").asLong(-1) != fingerprint.size()
                    || (root.hasNonNull("path") && !fingerprint.path().equals(root.get("path").asText()))) {
                return null;
            }

            final List<PageText> pages = new ArrayList<>();
            for (final JsonNode page : root.path("pages")) {
                final JsonNode number = page.get(0);
                final JsonNode body = page.get(1);
                if (body == null || !body.isTextual()) {
                    throw new IOException("Malformed page in cache entry");
                }
                pages.add(new PageText(number == null || number.isNull() ? null : number.asInt(), body.asText()));
            }
            return new ExtractedDocument(root.path("title").asText(""), fingerprint.path(), pages,
                    ExtractorKind.fromPersistedName(root.path("which").asText(null)));
        } catch (final IOException | RuntimeException e) {
            logger.warn("Ignoring unreadable extraction cache entry {}: {}", entryFile, e.getMessage());
            return null;
        }
    }

    private void store(final Path entryFile, final FileFingerprint fingerprint, final ExtractedDocument document) {
        maybePrune();

        final ObjectNode root = objectMapper.createObjectNode();
        root.put("title", document.title());
        root.put("path", fingerprint.path());
        final ArrayNode pages = root.putArray("pages");
        for (final PageText page : document.pages()) {
            final ArrayNode pageNode = pages.addArray();
            if (page.number() == null) {
                pageNode.addNull();
            } else {
                pageNode.add(page.number());
            }
            pageNode.add(page.body());
        }
        root.put("mtime_secs", fingerprint.mtimeSecs());
        root.put("size", fingerprint.size());
        root.put("which", document.extractor().persistedName());

        try {
            Files.createDirectories(cacheDirectory);
            final Path temp = Files.createTempFile(cacheDirectory, CachePruner.TEMP_PREFIX, CachePruner.TEMP_SUFFIX);
            try {
                objectMapper.writeValue(temp.toFile(), root);
                Files.move(temp, entryFile, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (final IOException e) {
            logger.warn("Failed to write extraction cache entry {}", entryFile, e);
        }

        maybePrune();
    }

    private void maybePrune() {
        final long now = System.currentTimeMillis();
        final long last = lastPruneMillis.get();
        if (now - last < pruneInterval.toMillis() || !lastPruneMillis.compareAndSet(last, now)) {
            return;
        }
        CachePruner.prune(cacheDirectory, maxBytes, maxAge);
    }
}
