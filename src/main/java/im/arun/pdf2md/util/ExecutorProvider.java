package im.arun.pdf2md.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the bounded worker pools batch conversion runs on.
 */
public final class ExecutorProvider {
    private static final AtomicInteger poolCounter = new AtomicInteger(0);

    private ExecutorProvider() {}

    /**
     * A fixed pool of daemon threads named {@code pdf2md-<pool>-worker-<n>}. The caller owns the
     * pool and must shut it down.
     */
    public static ExecutorService newWorkerPool(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + size);
        }
        int poolId = poolCounter.incrementAndGet();
        return Executors.newFixedThreadPool(size, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "pdf2md-" + poolId + "-worker-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }
}
