package de.mirkosertic.docsearch.crawler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Cheap change detector for a file: modification time in whole seconds plus size.
 * Two fingerprints are equal iff path, mtime and size are all equal; content is never hashed.
 */
public record FileFingerprint(String path, long mtimeSecs, long size) {

    public static FileFingerprint of(final Path file) throws IOException {
        final long mtime = Files.getLastModifiedTime(file).to(TimeUnit.SECONDS);
        return new FileFingerprint(file.toString(), mtime, Files.size(file));
    }
}
