package im.arun.mathreader.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared bounded pool for batch conversion. Parsing and rendering are CPU
 * bound, so the pool is sized to the available processors.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int poolSize = Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), 16));
                    instance = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "math-reader-worker-" + counter.incrementAndGet());
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
     * Shuts down the shared executor. The next {@link #getExecutor()} call
     * creates a new one.
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
