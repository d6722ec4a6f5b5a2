package de.mirkosertic.docsearch;

import de.mirkosertic.docsearch.crawler.DocumentIndexer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Answers free-text queries against the index through the shared {@link CachedIndexHandle}.
 */
public class SearchService {

    private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

    private static final String[] SEARCH_FIELDS = {DocumentIndexer.FIELD_TITLE, DocumentIndexer.FIELD_BODY};

    private final CachedIndexHandle indexHandle;
    private final int snippetMaxLength;
    private final StandardAnalyzer analyzer = new StandardAnalyzer();

    public SearchService(final CachedIndexHandle indexHandle, final int snippetMaxLength) {
        this.indexHandle = indexHandle;
        this.snippetMaxLength = snippetMaxLength;
    }

    /**
     * Top pages for {@code query} by relevance, expanded into one row per paragraph that contains
     * the query text, or a single row when none does. At most {@code limit} rows are returned.
     *
     * @throws IndexUnavailableException if no index exists yet
     * @throws SearchException           for unparsable queries and index read failures
     */
    public List<SearchHit> search(final String query, final int limit) throws SearchException {
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        final Query parsed = parse(new MultiFieldQueryParser(SEARCH_FIELDS, analyzer), query);

        return indexHandle.withSearcher(searcher -> {
            final TopDocs topDocs = runQuery(searcher, parsed, limit);
            final StoredFields storedFields = searcher.storedFields();
            final List<SearchHit> hits = new ArrayList<>();

            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                if (hits.size() >= limit) {
                    break;
                }
                final Document doc = storedFields.document(scoreDoc.doc);
                final String storedBody = doc.get(DocumentIndexer.FIELD_BODY);
                final String body = storedBody != null ? storedBody : "";

                List<String> snippets = SnippetGenerator.makeSnippets(body, query, snippetMaxLength);
                if (snippets.isEmpty()) {
                    snippets = List.of(SnippetGenerator.makeSnippet(body, query, snippetMaxLength));
                }

                for (final String snippet : snippets) {
                    if (hits.size() >= limit) {
                        break;
                    }
                    hits.add(new SearchHit(
                            doc.get(DocumentIndexer.FIELD_TITLE),
                            doc.get(DocumentIndexer.FIELD_PATH),
                            pageNumber(doc),
                            doc.get(DocumentIndexer.FIELD_SECTION),
                            snippet,
                            scoreDoc.score));
                }
            }

            logger.debug("Query '{}' matched {} page(s), returning {} row(s)",
                    query, topDocs.scoreDocs.length, hits.size());
            return hits;
        });
    }

    /**
     * Distinct page numbers of the document at {@code path} whose body matches {@code query},
     * in ascending order. A blank query matches every page of the document.
     */
    public List<Integer> searchPages(final String path, final @Nullable String query, final int limit)
            throws SearchException {
        if (path == null || path.isBlank() || limit <= 0) {
            return List.of();
        }

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(new TermQuery(DocumentIndexer.pathTerm(path)), BooleanClause.Occur.MUST);
        if (query != null && !query.isBlank()) {
            builder.add(parse(new QueryParser(DocumentIndexer.FIELD_BODY, analyzer), query), BooleanClause.Occur.MUST);
        }
        final Query pageQuery = builder.build();

        return indexHandle.withSearcher(searcher -> {
            final TopDocs topDocs = runQuery(searcher, pageQuery, limit);
            final StoredFields storedFields = searcher.storedFields();
            final SortedSet<Integer> pages = new TreeSet<>();
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Integer page = pageNumber(storedFields.document(scoreDoc.doc));
                if (page != null) {
                    pages.add(page);
                }
            }
            return new ArrayList<>(pages);
        });
    }

    private static Query parse(final QueryParser parser, final String query) throws SearchException {
        try {
            return parser.parse(query);
        } catch (final ParseException e) {
            throw new SearchException("Invalid query '" + query + "': " + e.getMessage(), e);
        }
    }

    private static TopDocs runQuery(final IndexSearcher searcher, final Query query, final int limit)
            throws IOException, SearchException {
        try {
            return searcher.search(query, limit);
        } catch (final IndexSearcher.TooManyClauses e) {
            throw new SearchException("Query expands to too many terms: " + e.getMessage(), e);
        }
    }

    private static @Nullable Integer pageNumber(final Document doc) {
        final IndexableField field = doc.getField(DocumentIndexer.FIELD_PAGE);
        if (field == null || field.numericValue() == null) {
            return null;
        }
        return field.numericValue().intValue();
    }
}
