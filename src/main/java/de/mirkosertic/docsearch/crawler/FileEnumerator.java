package de.mirkosertic.docsearch.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursively lists the files below the watched folders that pass the pattern filter.
 * Unreadable entries are logged and skipped; missing folders are skipped with a warning.
 */
public class FileEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(FileEnumerator.class);

    private final FilePatternMatcher matcher;

    public FileEnumerator(final FilePatternMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @return absolute file paths in traversal order, without duplicates from overlapping folders
     */
    public List<Path> enumerate(final List<String> watchedFolders) {
        final Set<Path> files = new LinkedHashSet<>();

        for (final String folder : watchedFolders) {
            final Path root = Paths.get(folder).toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                logger.warn("Skipping non-existent or non-directory path: {}", folder);
                continue;
            }

            try {
                Files.walkFileTree(root, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                        if (!dir.equals(root) && !matcher.shouldDescend(dir)) {
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && matcher.shouldInclude(file)) {
                            files.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                        logger.warn("Cannot access {}, skipping: {}", file, exc.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (final IOException e) {
                logger.error("Error walking directory {}", root, e);
            }
        }

        logger.info("Enumerated {} files in {} watched folder(s)", files.size(), watchedFolders.size());
        return new ArrayList<>(files);
    }
}
