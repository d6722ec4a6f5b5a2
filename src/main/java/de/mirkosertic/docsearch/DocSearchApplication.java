package de.mirkosertic.docsearch;

import de.mirkosertic.docsearch.config.ApplicationConfig;
import de.mirkosertic.docsearch.config.BuildInfo;
import de.mirkosertic.docsearch.config.LoggingConfigurator;
import de.mirkosertic.docsearch.extraction.CachePruner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point. Results go to stdout, logging to stderr (or the log file in
 * deployed mode).
 * <pre>
 *   rebuild                         full index rebuild of the configured folders
 *   update                          incremental update
 *   search &lt;query&gt; [limit]          ranked result rows
 *   pages &lt;path&gt; [query] [limit]    matching page numbers of one document
 *   prune-cache                     run extraction cache eviction now
 *   clear-cache                     delete every extraction cache entry
 * </pre>
 */
public class DocSearchApplication {

    private static final Logger logger = LoggerFactory.getLogger(DocSearchApplication.class);

    static final int DEFAULT_SEARCH_LIMIT = 20;
    static final int DEFAULT_PAGE_LIMIT = 1000;

    private final LibraryContext context;
    private final PrintStream out;

    public DocSearchApplication(final LibraryContext context, final PrintStream out) {
        this.context = context;
        this.out = out;
    }

    /**
     * @return process exit code
     */
    public int run(final List<String> args) {
        if (args.isEmpty()) {
            printUsage();
            return 2;
        }

        final String command = args.get(0);
        final List<String> arguments = args.subList(1, args.size());
        try {
            return switch (command) {
                case "rebuild" -> printResult(context.getIndexService().rebuild(context.getConfig().getDirectories()));
                case "update" -> printResult(context.getIndexService().update(context.getConfig().getDirectories()));
                case "search" -> search(arguments);
                case "pages" -> pages(arguments);
                case "prune-cache" -> pruneCache();
                case "clear-cache" -> {
                    out.println("Deleted " + context.getExtractionCache().clear() + " cache entries");
                    yield 0;
                }
                default -> {
                    printUsage();
                    yield 2;
                }
            };
        } catch (final IndexUnavailableException e) {
            out.println("No index available, run 'rebuild' first");
            return 3;
        } catch (final SearchException e) {
            logger.error("Search failed", e);
            out.println("Search failed: " + e.getMessage());
            return 1;
        } catch (final IOException e) {
            logger.error("Indexing failed", e);
            out.println("Indexing failed: " + e.getMessage());
            return 1;
        } catch (final NumberFormatException e) {
            out.println("Invalid limit: " + e.getMessage());
            return 2;
        }
    }

    private int printResult(final LuceneIndexService.IndexingResult result) {
        out.printf("%s: %d files found, %d indexed, %d failed, %d deleted, %d unchanged, %d documents in %d ms%n",
                result.mode(), result.filesFound(), result.filesIndexed(), result.filesFailed(),
                result.filesDeleted(), result.filesUnchanged(), result.documentsWritten(), result.elapsedMs());
        return 0;
    }

    private int search(final List<String> arguments) throws SearchException {
        if (arguments.isEmpty()) {
            printUsage();
            return 2;
        }
        final int limit = arguments.size() > 1 ? Integer.parseInt(arguments.get(1)) : DEFAULT_SEARCH_LIMIT;
        final List<SearchHit> hits = context.getSearchService().search(arguments.get(0), limit);
        for (final SearchHit hit : hits) {
            final String location = hit.page() != null ? hit.path() + "#page=" + hit.page() : hit.path();
            out.printf("%.3f  %s  (%s)%n    %s%n", hit.score(), hit.title(), location,
                    hit.snippet().replace("\n", " "));
        }
        out.println(hits.size() + " result(s)");
        return 0;
    }

    private int pages(final List<String> arguments) throws SearchException {
        if (arguments.isEmpty()) {
            printUsage();
            return 2;
        }
        final String query = arguments.size() > 1 ? arguments.get(1) : "";
        final int limit = arguments.size() > 2 ? Integer.parseInt(arguments.get(2)) : DEFAULT_PAGE_LIMIT;
        out.println(context.getSearchService().searchPages(arguments.get(0), query, limit));
        return 0;
    }

    private int pruneCache() {
        final CachePruner.PruneResult result = context.getExtractionCache().prune();
        out.println("Deleted " + result.deleted() + " cache entries, " + result.remainingBytes() + " bytes remaining");
        return 0;
    }

    private void printUsage() {
        out.println("DocSearch " + BuildInfo.getVersion());
        out.println("Usage: docsearch <command>");
        out.println("  rebuild                        rebuild the index from the watched folders");
        out.println("  update                         index changed files, drop deleted ones");
        out.println("  search <query> [limit]         search the index");
        out.println("  pages <path> [query] [limit]   list pages of a document matching the query");
        out.println("  prune-cache                    evict old extraction cache entries");
        out.println("  clear-cache                    delete all extraction cache entries");
    }

    public static void main(final String[] args) {
        // Configure logging FIRST, before any other code that might log
        final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty("docsearch.profile"));
        LoggingConfigurator.configure(deployedMode);

        int exitCode;
        try {
            final ApplicationConfig config = ApplicationConfig.load();
            logger.info("DocSearch {} (built {})", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());

            try (final LibraryContext context = LibraryContext.create(config)) {
                exitCode = new DocSearchApplication(context, System.out).run(Arrays.asList(args));
            }
        } catch (final Exception e) {
            System.err.println("DocSearch failed: " + e.getMessage());
            e.printStackTrace(System.err);
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
