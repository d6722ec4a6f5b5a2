package de.mirkosertic.docsearch.extraction;

/**
 * Thrown when a file cannot be turned into text by any applicable strategy.
 */
public class ExtractionException extends Exception {

    public ExtractionException(final String message) {
        super(message);
    }

    public ExtractionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
