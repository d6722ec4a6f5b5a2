package de.mirkosertic.docsearch;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CachedIndexHandle Tests")
class CachedIndexHandleTest {

    @TempDir
    Path tempDir;

    private Path indexPath;
    private CachedIndexHandle handle;

    @BeforeEach
    void setUp() {
        indexPath = tempDir.resolve("index");
        handle = new CachedIndexHandle(indexPath);
    }

    @AfterEach
    void tearDown() {
        handle.close();
    }

    private void addDocuments(final int count) throws IOException {
        try (final Directory directory = FSDirectory.open(indexPath);
             final IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(new StandardAnalyzer()))) {
            for (int i = 0; i < count; i++) {
                final Document doc = new Document();
                doc.add(new StringField("id", "doc-" + i + "-" + System.nanoTime(), Field.Store.YES));
                writer.addDocument(doc);
            }
            writer.commit();
        }
    }

    private int countAll() throws SearchException {
        return handle.withSearcher(searcher -> searcher.count(new MatchAllDocsQuery()));
    }

    @Test
    @DisplayName("Should open lazily on the first query")
    void shouldOpenLazily() throws Exception {
        // Given
        addDocuments(2);
        assertThat(handle.isOpen()).isFalse();

        // When
        final int count = countAll();

        // Then
        assertThat(count).isEqualTo(2);
        assertThat(handle.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Should report a missing index and stay closed")
    void shouldFailWithoutIndex() throws Exception {
        assertThatThrownBy(this::countAll).isInstanceOf(IndexUnavailableException.class);

        Files.createDirectories(indexPath);
        assertThatThrownBy(this::countAll).isInstanceOf(IndexUnavailableException.class);
        assertThat(handle.isOpen()).isFalse();
    }

    @Test
    @DisplayName("Should see new commits after invalidation")
    void shouldReopenAfterInvalidate() throws Exception {
        addDocuments(1);
        assertThat(countAll()).isEqualTo(1);

        addDocuments(3);
        handle.invalidate();

        assertThat(handle.isOpen()).isFalse();
        assertThat(countAll()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should allow invalidation when nothing is open")
    void shouldInvalidateWhenClosed() {
        handle.invalidate();
        handle.invalidate();

        assertThat(handle.isOpen()).isFalse();
    }

    @Test
    @DisplayName("Should serve concurrent queries from one shared reader")
    void shouldServeConcurrentQueries() throws Exception {
        addDocuments(5);
        final ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            final Callable<Integer> query = this::countAll;
            final List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                results.add(pool.submit(query));
            }
            for (final Future<Integer> result : results) {
                assertThat(result.get()).isEqualTo(5);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should wrap failures of the search action")
    void shouldWrapIoFailures() throws Exception {
        addDocuments(1);

        assertThatThrownBy(() -> handle.withSearcher(searcher -> {
            throw new IOException("disk gone");
        })).isInstanceOf(SearchException.class).hasMessageContaining("disk gone");
        assertThat(countAll()).isEqualTo(1);
    }
}
