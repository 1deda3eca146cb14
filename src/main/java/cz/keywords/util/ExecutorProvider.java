package cz.keywords.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared bounded thread pool for the parallel corpus lookup.
 * Keeps {@code CompletableFuture.supplyAsync()} off the common ForkJoinPool.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Returns the shared executor, creating it on first use.
     * Lookups are CPU-bound, so the pool has one thread per available processor.
     */
    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int poolSize = Math.max(1, Runtime.getRuntime().availableProcessors());
                    instance = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "keywords-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}
