package de.mirkosertic.docsearch.extraction;

import java.util.List;

/**
 * Result of a successful extraction.
 *
 * @param title     document title, never empty (falls back to the file name)
 * @param path      absolute path of the source file
 * @param pages     pages ordered by ascending page number
 * @param extractor tier of the strategy that produced this result
 */
public record ExtractedDocument(String title, String path, List<PageText> pages, ExtractorKind extractor) {

    public ExtractedDocument {
        pages = List.copyOf(pages);
    }

    public boolean isPaged() {
        return !pages.isEmpty() && pages.get(0).number() != null;
    }

    /**
     * A copy holding at most {@code maxPages} pages.
     */
    public ExtractedDocument truncate(final int maxPages) {
        if (maxPages < 0 || pages.size() <= maxPages) {
            return this;
        }
        return new ExtractedDocument(title, path, pages.subList(0, maxPages), extractor);
    }
}
