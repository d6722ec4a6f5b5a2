package de.mirkosertic.docsearch;

import org.jspecify.annotations.Nullable;

/**
 * One result row. A document may contribute several rows, one per matching paragraph.
 *
 * @param title   document title
 * @param path    absolute path of the source file
 * @param page    1-based page number for paged documents, null otherwise
 * @param section extractor name for PDF pages, null otherwise
 * @param snippet excerpt around the match
 * @param score   Lucene relevance score of the page
 */
public record SearchHit(String title, String path, @Nullable Integer page, @Nullable String section,
                        String snippet, float score) {
}
