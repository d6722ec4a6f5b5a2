package de.mirkosertic.docsearch.extraction;

import org.jspecify.annotations.Nullable;

/**
 * Tagged result of running the extraction chain on one file.
 *
 * @param status        which tier produced the document, or FAILED
 * @param document      the extracted document, null when FAILED
 * @param failureReason why every strategy failed, null otherwise
 */
public record ExtractionOutcome(Status status, @Nullable ExtractedDocument document, @Nullable String failureReason) {

    public enum Status {
        PRIMARY,
        FALLBACK,
        FAILED
    }

    public static ExtractionOutcome of(final ExtractedDocument document) {
        final Status status = switch (document.extractor()) {
            case PRIMARY -> Status.PRIMARY;
            case FALLBACK -> Status.FALLBACK;
        };
        return new ExtractionOutcome(status, document, null);
    }

    public static ExtractionOutcome failed(final String reason) {
        return new ExtractionOutcome(Status.FAILED, null, reason);
    }

    public boolean isSuccess() {
        return status != Status.FAILED;
    }

    /**
     * The document, or an {@link ExtractionException} carrying the failure reason.
     */
    public ExtractedDocument orElseThrow() throws ExtractionException {
        if (document == null) {
            throw new ExtractionException(failureReason);
        }
        return document;
    }
}
