package de.mirkosertic.docsearch;

import de.mirkosertic.docsearch.crawler.DocumentIndexer;
import de.mirkosertic.docsearch.extraction.ExtractedDocument;
import de.mirkosertic.docsearch.extraction.ExtractorKind;
import de.mirkosertic.docsearch.extraction.PageText;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchService Tests")
class SearchServiceTest {

    private static final String NOTES = "/library/notes.txt";
    private static final String MANUAL = "/library/manual.pdf";

    @TempDir
    Path tempDir;

    private Path indexPath;
    private CachedIndexHandle indexHandle;
    private SearchService searchService;

    @BeforeEach
    void setUp() {
        indexPath = tempDir.resolve("index");
        indexHandle = new CachedIndexHandle(indexPath);
        searchService = new SearchService(indexHandle, 40);
    }

    @AfterEach
    void tearDown() {
        indexHandle.close();
    }

    private void index(final ExtractedDocument... documents) throws IOException {
        final DocumentIndexer indexer = new DocumentIndexer(300);
        try (final Directory directory = FSDirectory.open(indexPath);
             final IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(new StandardAnalyzer()))) {
            for (final ExtractedDocument document : documents) {
                indexer.addDocuments(writer, document);
            }
            writer.commit();
        }
        indexHandle.invalidate();
    }

    private static ExtractedDocument notes(final String body) {
        return new ExtractedDocument("Garden Notes", NOTES, List.of(PageText.unpaged(body)), ExtractorKind.PRIMARY);
    }

    private static ExtractedDocument manual() {
        return new ExtractedDocument("Solar Manual", MANUAL, List.of(
                new PageText(1, "Mounting the solar panels on the roof."),
                new PageText(2, "Wiring the inverter."),
                new PageText(3, "Cleaning solar panels twice a year.")), ExtractorKind.FALLBACK);
    }

    @Nested
    @DisplayName("Free-text search")
    class FreeText {

        @Test
        @DisplayName("Should return one row per matching paragraph")
        void shouldExpandParagraphs() throws Exception {
            // Given
            index(notes("Tomatoes need sun daily.\n\nNothing to see here.\n\nPeppers need sun too."));

            // When
            final List<SearchHit> hits = searchService.search("sun", 10);

            // Then
            assertThat(hits).hasSize(2);
            assertThat(hits).extracting(SearchHit::path).containsOnly(NOTES);
            assertThat(hits.get(0).snippet()).contains("Tomatoes");
            assertThat(hits.get(1).snippet()).contains("Peppers");
            assertThat(hits.get(0).score()).isEqualTo(hits.get(1).score());
        }

        @Test
        @DisplayName("Should return a single head row when no paragraph contains the query text")
        void shouldFallBackToHeadSnippet() throws Exception {
            index(notes("Tomatoes need sun.\n\nPeppers need water."));

            final List<SearchHit> hits = searchService.search("tomatoes AND peppers", 10);

            assertThat(hits).hasSize(1);
            assertThat(hits.get(0).snippet()).startsWith("Tomatoes");
        }

        @Test
        @DisplayName("Should cap the number of rows at the limit")
        void shouldApplyLimit() throws Exception {
            index(notes("sun one\n\nsun two\n\nsun three"), manual());

            assertThat(searchService.search("sun", 2)).hasSize(2);
        }

        @Test
        @DisplayName("Should report page number and extractor for paged documents")
        void shouldReportPages() throws Exception {
            index(manual());

            final List<SearchHit> hits = searchService.search("inverter", 10);

            assertThat(hits).hasSize(1);
            assertThat(hits.get(0).page()).isEqualTo(2);
            assertThat(hits.get(0).section()).isEqualTo("structural");
            assertThat(hits.get(0).title()).isEqualTo("Solar Manual");
        }

        @Test
        @DisplayName("Should match the title field")
        void shouldMatchTitle() throws Exception {
            index(notes("Nothing relevant in the body."));

            final List<SearchHit> hits = searchService.search("garden", 10);

            assertThat(hits).hasSize(1);
            assertThat(hits.get(0).snippet()).startsWith("Nothing relevant");
        }

        @Test
        @DisplayName("Should keep snippets within the configured length")
        void shouldLimitSnippetLength() throws Exception {
            index(notes("word ".repeat(50) + "needle " + "word ".repeat(50)));

            final List<SearchHit> hits = searchService.search("needle", 10);

            assertThat(hits.get(0).snippet()).contains("needle");
            assertThat(hits.get(0).snippet().length()).isLessThanOrEqualTo(40 + "needle".length());
        }

        @Test
        @DisplayName("Should return nothing for a blank query or non-positive limit")
        void shouldIgnoreBlankQuery() throws Exception {
            index(notes("anything"));

            assertThat(searchService.search("   ", 10)).isEmpty();
            assertThat(searchService.search("anything", 0)).isEmpty();
        }

        @Test
        @DisplayName("Should fail with IndexUnavailableException before the first rebuild")
        void shouldFailWithoutIndex() {
            assertThatThrownBy(() -> searchService.search("anything", 10))
                    .isInstanceOf(IndexUnavailableException.class);
        }

        @Test
        @DisplayName("Should reject an unparsable query")
        void shouldRejectInvalidQuery() throws Exception {
            index(notes("anything"));

            assertThatThrownBy(() -> searchService.search("title:(", 10))
                    .isInstanceOf(SearchException.class)
                    .isNotInstanceOf(IndexUnavailableException.class)
                    .hasMessageContaining("Invalid query");
        }
    }

    @Nested
    @DisplayName("Page search")
    class PageSearch {

        @Test
        @DisplayName("Should return matching page numbers in ascending order")
        void shouldFindPages() throws Exception {
            index(manual(), notes("solar notes"));

            assertThat(searchService.searchPages(MANUAL, "solar", 10)).containsExactly(1, 3);
        }

        @Test
        @DisplayName("Should return every page for a blank query")
        void shouldReturnAllPagesForBlankQuery() throws Exception {
            index(manual());

            assertThat(searchService.searchPages(MANUAL, "", 10)).containsExactly(1, 2, 3);
            assertThat(searchService.searchPages(MANUAL, null, 10)).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("Should only consider pages of the given path")
        void shouldRestrictToPath() throws Exception {
            index(manual());

            assertThat(searchService.searchPages("/library/other.pdf", "solar", 10)).isEmpty();
            assertThat(searchService.searchPages(NOTES, "solar", 10)).isEmpty();
        }

        @Test
        @DisplayName("Should return no page numbers for non-paged documents")
        void shouldIgnoreUnpagedDocuments() throws Exception {
            index(notes("solar notes"));

            assertThat(searchService.searchPages(NOTES, "solar", 10)).isEmpty();
        }
    }
}
