package de.mirkosertic.docsearch.crawler;

import de.mirkosertic.docsearch.extraction.ExtractedDocument;
import de.mirkosertic.docsearch.extraction.PageText;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps extracted documents onto the fixed index schema: one Lucene document per page.
 */
public class DocumentIndexer {

    private static final Logger logger = LoggerFactory.getLogger(DocumentIndexer.class);

    /**
     * Schema version for the index.
     * MUST be incremented whenever fields or analyzers change; a mismatch forces a full rebuild.
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String FIELD_TITLE = "title";
    public static final String FIELD_PATH = "path";
    public static final String FIELD_PAGE = "page";
    public static final String FIELD_SECTION = "section";
    public static final String FIELD_BODY = "body";

    private final int maxPdfPages;

    public DocumentIndexer(final int maxPdfPages) {
        this.maxPdfPages = maxPdfPages;
    }

    public List<Document> createDocuments(final ExtractedDocument extracted) {
        final List<Document> documents = new ArrayList<>();
        final boolean paged = extracted.isPaged();
        final List<PageText> pages = paged && extracted.pages().size() > maxPdfPages
                ? extracted.pages().subList(0, maxPdfPages)
                : extracted.pages();

        for (final PageText page : pages) {
            final Document doc = new Document();

            // path - exact identity, never tokenized
            doc.add(new StringField(FIELD_PATH, extracted.path(), Field.Store.YES));
            doc.add(new TextField(FIELD_TITLE, extracted.title(), Field.Store.YES));

            if (page.number() != null) {
                doc.add(new IntPoint(FIELD_PAGE, page.number()));
                doc.add(new StoredField(FIELD_PAGE, page.number()));
                // section records which extractor produced the page text
                doc.add(new StringField(FIELD_SECTION, extracted.extractor().persistedName(), Field.Store.YES));
            }

            doc.add(new TextField(FIELD_BODY, page.body(), Field.Store.YES));
            documents.add(doc);
        }

        if (pages.size() < extracted.pages().size()) {
            logger.debug("Indexed {} of {} pages of {}", pages.size(), extracted.pages().size(), extracted.path());
        }
        return documents;
    }

    public static Term pathTerm(final String path) {
        return new Term(FIELD_PATH, path);
    }

    /**
     * Replace all pages of a document atomically. A document without pages is removed.
     */
    public int replaceDocuments(final IndexWriter writer, final ExtractedDocument extracted) throws IOException {
        final List<Document> documents = createDocuments(extracted);
        if (documents.isEmpty()) {
            writer.deleteDocuments(pathTerm(extracted.path()));
        } else {
            writer.updateDocuments(pathTerm(extracted.path()), documents);
        }
        return documents.size();
    }

    public int addDocuments(final IndexWriter writer, final ExtractedDocument extracted) throws IOException {
        final List<Document> documents = createDocuments(extracted);
        if (!documents.isEmpty()) {
            writer.addDocuments(documents);
        }
        return documents.size();
    }

    public void deleteDocuments(final IndexWriter writer, final String path) throws IOException {
        writer.deleteDocuments(pathTerm(path));
    }
}
