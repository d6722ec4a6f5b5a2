package de.mirkosertic.docsearch.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Size and age bounded eviction for the extraction cache directory. Entries past the age
 * ceiling go first, then the oldest-modified entries until the total fits the byte budget.
 * Only files named {@code doc_*.json} count as entries. Partial writes ({@code tmp_*.part}) left
 * behind by an interrupted process are deleted once they pass the age ceiling. Errors are logged,
 * never thrown.
 */
public final class CachePruner {

    private static final Logger logger = LoggerFactory.getLogger(CachePruner.class);

    static final String ENTRY_PREFIX = "doc_";
    static final String ENTRY_SUFFIX = ".json";
    static final String TEMP_PREFIX = "tmp_";
    static final String TEMP_SUFFIX = ".part";

    /**
     * @param deleted        number of entries removed
     * @param remainingBytes total size of the managed entries left behind
     */
    public record PruneResult(int deleted, long remainingBytes) {
    }

    private record Entry(Path file, long size, Instant modified) {
    }

    private CachePruner() {
    }

    public static boolean isManagedEntry(final Path file) {
        final Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        final String fileName = name.toString();
        return fileName.startsWith(ENTRY_PREFIX) && fileName.endsWith(ENTRY_SUFFIX);
    }

    static boolean isPartialWrite(final Path file) {
        final Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        final String fileName = name.toString();
        return fileName.startsWith(TEMP_PREFIX) && fileName.endsWith(TEMP_SUFFIX);
    }

    public static PruneResult prune(final Path cacheDirectory, final long maxBytes, final Duration maxAge) {
        return prune(cacheDirectory, maxBytes, maxAge, Instant.now());
    }

    static PruneResult prune(final Path cacheDirectory, final long maxBytes, final Duration maxAge, final Instant now) {
        final Instant cutoff = now.minus(maxAge);
        final List<Entry> entries = new ArrayList<>();
        final List<Entry> partialWrites = new ArrayList<>();
        listFiles(cacheDirectory, entries, partialWrites);

        for (final Entry partial : partialWrites) {
            if (partial.modified().isBefore(cutoff) && delete(partial.file())) {
                logger.debug("Deleted abandoned partial write {}", partial.file());
            }
        }

        if (entries.isEmpty()) {
            return new PruneResult(0, 0);
        }

        long total = 0;
        for (final Entry entry : entries) {
            total += entry.size();
        }

        int deleted = 0;
        final List<Entry> kept = new ArrayList<>();
        for (final Entry entry : entries) {
            if (entry.modified().isBefore(cutoff) && delete(entry.file())) {
                total -= entry.size();
                deleted++;
            } else {
                kept.add(entry);
            }
        }

        if (total > maxBytes) {
            kept.sort(Comparator.comparing(Entry::modified));
            for (final Entry entry : kept) {
                if (total <= maxBytes) {
                    break;
                }
                if (delete(entry.file())) {
                    total -= entry.size();
                    deleted++;
                }
            }
        }

        if (deleted > 0) {
            logger.info("Pruned {} extraction cache entries, {} bytes remaining", deleted, total);
        }
        return new PruneResult(deleted, total);
    }

    private static void listFiles(final Path cacheDirectory, final List<Entry> entries,
                                  final List<Entry> partialWrites) {
        if (!Files.isDirectory(cacheDirectory)) {
            return;
        }
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDirectory)) {
            for (final Path file : stream) {
                final List<Entry> target;
                if (isManagedEntry(file)) {
                    target = entries;
                } else if (isPartialWrite(file)) {
                    target = partialWrites;
                } else {
                    continue;
                }
                try {
                    final BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                    if (attributes.isRegularFile()) {
                        target.add(new Entry(file, attributes.size(), attributes.lastModifiedTime().toInstant()));
                    }
                } catch (final IOException e) {
                    logger.debug("Cannot stat cache entry {}", file, e);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to list extraction cache directory {}", cacheDirectory, e);
        }
    }

    private static boolean delete(final Path file) {
        try {
            Files.deleteIfExists(file);
            return true;
        } catch (final IOException e) {
            logger.warn("Failed to delete cache entry {}", file, e);
            return false;
        }
    }
}
