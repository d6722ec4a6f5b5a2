package de.mirkosertic.docsearch;

import java.nio.file.Path;

/**
 * No index directory exists yet. Callers may fall back to scanning files directly.
 */
public class IndexUnavailableException extends SearchException {

    public IndexUnavailableException(final Path indexPath) {
        super("No search index at " + indexPath);
    }
}
