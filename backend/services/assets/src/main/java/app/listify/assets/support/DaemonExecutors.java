package app.listify.assets.support;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pools of daemon threads named {@code <prefix>-N}. Owners shut them down in
 * their {@code @PreDestroy} hook.
 */
public final class DaemonExecutors {

    private DaemonExecutors() {
    }

    public static ExecutorService fixed(String prefix, int threads) {
        int poolSize = Math.max(threads, 1);
        return new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory(prefix)
        );
    }

    public static ScheduledExecutorService scheduled(String prefix) {
        return Executors.newSingleThreadScheduledExecutor(threadFactory(prefix));
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
