package de.mirkosertic.docsearch.crawler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persists the fingerprints of the files indexed by the last rebuild or update as a JSON
 * object {@code {"<path>": [mtime_secs, size], ...}} next to the index.
 * <p>
 * Loading never fails: a missing or unreadable snapshot is an empty snapshot, which makes
 * the next incremental update treat every file as changed. Save failures are logged.
 */
public class FingerprintStore {

    private static final Logger logger = LoggerFactory.getLogger(FingerprintStore.class);

    private static final TypeReference<Map<String, long[]>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final Path snapshotFile;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FingerprintStore(final Path snapshotFile) {
        this.snapshotFile = snapshotFile;
    }

    public Path getSnapshotFile() {
        return snapshotFile;
    }

    public Map<String, FileFingerprint> load() {
        if (!Files.isRegularFile(snapshotFile)) {
            return new HashMap<>();
        }
        try {
            final Map<String, long[]> raw = objectMapper.readValue(snapshotFile.toFile(), SNAPSHOT_TYPE);
            final Map<String, FileFingerprint> snapshot = new HashMap<>();
            for (final Map.Entry<String, long[]> entry : raw.entrySet()) {
                final long[] value = entry.getValue();
                if (value == null || value.length != 2) {
                    logger.warn("Ignoring malformed fingerprint for {}", entry.getKey());
                    continue;
                }
                snapshot.put(entry.getKey(), new FileFingerprint(entry.getKey(), value[0], value[1]));
            }
            logger.debug("Loaded {} fingerprints from {}", snapshot.size(), snapshotFile);
            return snapshot;
        } catch (final IOException e) {
            logger.warn("Failed to load fingerprint snapshot {}, treating all files as changed", snapshotFile, e);
            return new HashMap<>();
        }
    }

    public void save(final Collection<FileFingerprint> fingerprints) {
        final Map<String, long[]> raw = new TreeMap<>();
        for (final FileFingerprint fingerprint : fingerprints) {
            raw.put(fingerprint.path(), new long[]{fingerprint.mtimeSecs(), fingerprint.size()});
        }
        try {
            final Path parent = snapshotFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            final Path temp = Files.createTempFile(parent, "fingerprints", ".part");
            try {
                objectMapper.writeValue(temp.toFile(), raw);
                Files.move(temp, snapshotFile, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            logger.debug("Saved {} fingerprints to {}", raw.size(), snapshotFile);
        } catch (final IOException e) {
            logger.warn("Failed to save fingerprint snapshot {}", snapshotFile, e);
        }
    }

    public void delete() {
        try {
            Files.deleteIfExists(snapshotFile);
        } catch (final IOException e) {
            logger.warn("Failed to delete fingerprint snapshot {}", snapshotFile, e);
        }
    }
}
