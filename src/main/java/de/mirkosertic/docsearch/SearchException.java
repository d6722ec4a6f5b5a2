package de.mirkosertic.docsearch;

/**
 * A query could not be answered: the index is unavailable, the query does not parse,
 * reading the index failed, or the caller was interrupted while waiting for the index.
 */
public class SearchException extends Exception {

    public SearchException(final String message) {
        super(message);
    }

    public SearchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
