package de.mirkosertic.docsearch.extraction;

import org.jspecify.annotations.Nullable;

/**
 * Text of one page. Non-paged documents carry a single page without number.
 *
 * @param number 1-based page number, or null for non-paged documents
 * @param body   sanitized, paragraph-normalized text
 */
public record PageText(@Nullable Integer number, String body) {

    public static PageText unpaged(final String body) {
        return new PageText(null, body);
    }
}
