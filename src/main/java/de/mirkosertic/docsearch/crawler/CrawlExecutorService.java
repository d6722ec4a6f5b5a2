package de.mirkosertic.docsearch.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool for parallel extraction during rebuild and update.
 * Workers only extract; index writes stay on the coordinating thread.
 */
public class CrawlExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(CrawlExecutorService.class);

    private final ThreadPoolExecutor executor;
    private final int threads;

    public CrawlExecutorService(final int threads) {
        this.threads = threads;
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "extractor-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("CrawlExecutorService initialized with {} threads", threads);
    }

    public int getThreads() {
        return threads;
    }

    /**
     * A completion service on this pool; results are taken in completion order.
     */
    public <T> CompletionService<T> newCompletionService() {
        return new ExecutorCompletionService<>(executor);
    }

    /**
     * Shutdown the executor service. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down CrawlExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("CrawlExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for CrawlExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
