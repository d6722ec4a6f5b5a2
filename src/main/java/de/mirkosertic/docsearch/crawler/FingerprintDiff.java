package de.mirkosertic.docsearch.crawler;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Difference between the previous fingerprint snapshot and the files found now.
 *
 * @param changed        files that are new or whose fingerprint differs, keyed by path
 * @param deleted        paths in the previous snapshot that no longer exist
 * @param unchangedCount number of files whose fingerprint is identical
 */
public record FingerprintDiff(Map<String, FileFingerprint> changed, Set<String> deleted, int unchangedCount) {

    public static FingerprintDiff compute(final Map<String, FileFingerprint> previous,
                                          final Collection<FileFingerprint> current) {
        final Map<String, FileFingerprint> changed = new LinkedHashMap<>();
        final Set<String> currentPaths = new TreeSet<>();
        int unchanged = 0;

        for (final FileFingerprint fingerprint : current) {
            currentPaths.add(fingerprint.path());
            if (fingerprint.equals(previous.get(fingerprint.path()))) {
                unchanged++;
            } else {
                changed.put(fingerprint.path(), fingerprint);
            }
        }

        final Set<String> deleted = new TreeSet<>();
        for (final String path : previous.keySet()) {
            if (!currentPaths.contains(path)) {
                deleted.add(path);
            }
        }

        return new FingerprintDiff(changed, deleted, unchanged);
    }

    public boolean isEmpty() {
        return changed.isEmpty() && deleted.isEmpty();
    }
}
