package de.mirkosertic.docsearch;

import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lazily opened, shared (Directory, SearcherManager) pair for the on-disk index.
 * <p>
 * Queries run under the read lock. Opening and {@link #invalidate() invalidation} take the
 * write lock. The pair is opened by the first query after the index exists and torn down after
 * every committed rebuild or update, so the next query reopens the current segments.
 */
public class CachedIndexHandle implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(CachedIndexHandle.class);

    /**
     * Work done with an acquired searcher.
     */
    @FunctionalInterface
    public interface SearchAction<T> {
        T apply(IndexSearcher searcher) throws IOException, SearchException;
    }

    private final Path indexPath;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private @Nullable Directory directory;
    private @Nullable SearcherManager searcherManager;

    public CachedIndexHandle(final Path indexPath) {
        this.indexPath = indexPath;
    }

    public Path getIndexPath() {
        return indexPath;
    }

    /**
     * Run {@code action} against a searcher that sees the latest commit.
     *
     * @throws IndexUnavailableException if no index exists
     * @throws SearchException           if the index cannot be read or the wait for a lock was interrupted
     */
    public <T> T withSearcher(final SearchAction<T> action) throws SearchException {
        final SearcherManager manager = acquireManager();
        try {
            manager.maybeRefreshBlocking();
            final IndexSearcher searcher = manager.acquire();
            try {
                return action.apply(searcher);
            } finally {
                manager.release(searcher);
            }
        } catch (final IOException e) {
            throw new SearchException("Failed to read the search index: " + e.getMessage(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Close the cached reader so the next query reopens the index. Safe to call when nothing is open.
     */
    public void invalidate() {
        lock.writeLock().lock();
        try {
            closeQuietly();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isOpen() {
        lock.readLock().lock();
        try {
            return searcherManager != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        invalidate();
    }

    /**
     * Returns with the read lock held.
     */
    private SearcherManager acquireManager() throws SearchException {
        lockInterruptibly(lock.readLock());
        final SearcherManager existing = searcherManager;
        if (existing != null) {
            return existing;
        }
        lock.readLock().unlock();

        lockInterruptibly(lock.writeLock());
        try {
            if (searcherManager == null) {
                open();
            }
            // downgrade: take the read lock before giving up the write lock
            lock.readLock().lock();
            return searcherManager;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void open() throws SearchException {
        if (!Files.isDirectory(indexPath)) {
            throw new IndexUnavailableException(indexPath);
        }
        Directory opened = null;
        try {
            opened = FSDirectory.open(indexPath);
            if (!DirectoryReader.indexExists(opened)) {
                opened.close();
                throw new IndexUnavailableException(indexPath);
            }
            searcherManager = new SearcherManager(opened, null);
            directory = opened;
            logger.debug("Opened search index at {}", indexPath);
        } catch (final IOException e) {
            if (opened != null) {
                try {
                    opened.close();
                } catch (final IOException closeError) {
                    e.addSuppressed(closeError);
                }
            }
            throw new SearchException("Failed to open the search index: " + e.getMessage(), e);
        }
    }

    private void closeQuietly() {
        if (searcherManager != null) {
            try {
                searcherManager.close();
            } catch (final IOException e) {
                logger.warn("Failed to close SearcherManager", e);
            }
            searcherManager = null;
        }
        if (directory != null) {
            try {
                directory.close();
            } catch (final IOException e) {
                logger.warn("Failed to close index directory", e);
            }
            directory = null;
            logger.debug("Invalidated search index handle");
        }
    }

    private static void lockInterruptibly(final Lock target) throws SearchException {
        try {
            target.lockInterruptibly();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchException("Interrupted while waiting for the search index", e);
        }
    }
}
