package de.mirkosertic.docsearch.crawler;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Glob based file filter. Exclude patterns are matched against the full path,
 * include patterns against the file name only.
 */
public class FilePatternMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public FilePatternMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = toMatchers(includePatterns);
        this.excludeMatchers = toMatchers(excludePatterns);
    }

    private static List<PathMatcher> toMatchers(final List<String> patterns) {
        return patterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public boolean shouldInclude(final Path file) {
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(file)) {
                return false;
            }
        }

        // No include patterns means everything not excluded
        if (includeMatchers.isEmpty()) {
            return true;
        }

        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        for (final PathMatcher includeMatcher : includeMatchers) {
            if (includeMatcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a directory should be descended into. Directories are only checked against
     * the exclude patterns, with a trailing separator so that {@code **}{@code /name/**} matches.
     */
    public boolean shouldDescend(final Path directory) {
        final Path candidate = directory.resolve("x");
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(candidate)) {
                return false;
            }
        }
        return true;
    }
}
