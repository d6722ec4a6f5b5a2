package de.mirkosertic.docsearch.extraction;

import java.nio.file.Path;

/**
 * One link of the extraction chain.
 */
public interface ExtractionStrategy {

    ExtractorKind kind();

    /**
     * Whether this strategy understands the given file, judged by its name only.
     */
    boolean supports(Path file);

    /**
     * Whether this strategy can run right now. Strategies that depend on a lazily bound
     * parser report false when binding failed.
     */
    default boolean isAvailable() {
        return true;
    }

    ExtractedDocument extract(Path file) throws ExtractionException;
}
