package de.mirkosertic.docsearch;

import de.mirkosertic.docsearch.config.ApplicationConfig;
import de.mirkosertic.docsearch.crawler.CrawlExecutorService;
import de.mirkosertic.docsearch.crawler.DocumentIndexer;
import de.mirkosertic.docsearch.crawler.FileEnumerator;
import de.mirkosertic.docsearch.crawler.FilePatternMatcher;
import de.mirkosertic.docsearch.crawler.FingerprintStore;
import de.mirkosertic.docsearch.extraction.ContentExtractor;
import de.mirkosertic.docsearch.extraction.ExtractionCache;
import de.mirkosertic.docsearch.extraction.TikaBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;

/**
 * Owns every long-lived piece of the search core: the Tika binding, the extraction cache,
 * the crawl pool and the cached index handle. Components receive what they need from here;
 * nothing is held in static state.
 */
public class LibraryContext implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(LibraryContext.class);

    private final ApplicationConfig config;
    private final TikaBinding tikaBinding;
    private final ContentExtractor contentExtractor;
    private final ExtractionCache extractionCache;
    private final CrawlExecutorService crawlExecutor;
    private final CachedIndexHandle indexHandle;
    private final LuceneIndexService indexService;
    private final SearchService searchService;

    private LibraryContext(final ApplicationConfig config) {
        this.config = config;

        // Initialize services in dependency order
        this.tikaBinding = new TikaBinding(config.isPrimaryExtractorEnabled(), config.getTikaConfigPath(),
                config.getDataDirectory());
        this.contentExtractor = ContentExtractor.createDefault(tikaBinding, config.getTextMaxBytes());
        this.extractionCache = new ExtractionCache(
                contentExtractor,
                config.getCachePath(),
                config.getCacheMaxBytes(),
                Duration.ofDays(config.getCacheMaxAgeDays()),
                Duration.ofMinutes(config.getPruneIntervalMinutes())
        );
        this.crawlExecutor = new CrawlExecutorService(config.getEffectiveThreadPoolSize());
        this.indexHandle = new CachedIndexHandle(config.getIndexPath());

        final FileEnumerator fileEnumerator = new FileEnumerator(
                new FilePatternMatcher(config.getIncludePatterns(), config.getExcludePatterns()));

        this.indexService = new LuceneIndexService(
                config.getIndexPath(),
                extractionCache,
                new FingerprintStore(config.getFingerprintPath()),
                fileEnumerator,
                new DocumentIndexer(config.getIndexMaxPdfPages()),
                crawlExecutor,
                indexHandle,
                config.getCacheMaxPages()
        );
        this.searchService = new SearchService(indexHandle, config.getSnippetMaxLength());
    }

    public static LibraryContext create(final ApplicationConfig config) {
        logger.info("Creating library context with data directory {}", config.getDataDirectory());
        return new LibraryContext(config);
    }

    public ApplicationConfig getConfig() {
        return config;
    }

    public TikaBinding getTikaBinding() {
        return tikaBinding;
    }

    public ContentExtractor getContentExtractor() {
        return contentExtractor;
    }

    public ExtractionCache getExtractionCache() {
        return extractionCache;
    }

    public CachedIndexHandle getIndexHandle() {
        return indexHandle;
    }

    public LuceneIndexService getIndexService() {
        return indexService;
    }

    public SearchService getSearchService() {
        return searchService;
    }

    /**
     * Shutdown in reverse order of creation.
     */
    @Override
    public void close() {
        try {
            crawlExecutor.shutdown();
        } catch (final RuntimeException e) {
            logger.error("Error shutting down crawl executor", e);
        }
        indexHandle.close();
        logger.info("Library context closed");
    }
}
