package im.arun.promptelide.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Worker pool for eliding several documents at once.
 *
 * <p>The pool is sized by the {@code parallelism} setting; zero or less means one thread per
 * processor. Asking for a different size replaces the pool, letting queued work on the old one finish.
 */
public final class ExecutorProvider {
    private static final Logger logger = LoggerFactory.getLogger(ExecutorProvider.class);

    private static final Object LOCK = new Object();
    private static final AtomicInteger WORKERS = new AtomicInteger(0);
    private static ExecutorService instance;
    private static int instanceSize;

    private ExecutorProvider() {}

    public static ExecutorService getExecutor() {
        return getExecutor(0);
    }

    public static ExecutorService getExecutor(int parallelism) {
        int size = poolSize(parallelism);
        synchronized (LOCK) {
            if (instance == null || instanceSize != size) {
                if (instance != null) {
                    instance.shutdown();
                }
                logger.debug("Starting elision pool with {} threads", size);
                instance = Executors.newFixedThreadPool(size, runnable -> {
                    Thread thread = new Thread(runnable, "elide-worker-" + WORKERS.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
                instanceSize = size;
            }
            return instance;
        }
    }

    static int poolSize(int parallelism) {
        return parallelism > 0 ? parallelism : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Runs {@code task} for every input on the pool and returns the results in input order.
     * Waits for all tasks, then rethrows the failure of the first failed input.
     */
    public static <T, R> List<R> mapInOrder(List<T> inputs, Function<T, R> task, int parallelism) {
        ExecutorService executor = getExecutor(parallelism);
        List<CompletableFuture<R>> futures = inputs.stream()
            .map(input -> CompletableFuture.supplyAsync(() -> task.apply(input), executor))
            .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).exceptionally(e -> null).join();

        return futures.stream()
            .map(future -> {
                try {
                    return future.join();
                } catch (CompletionException e) {
                    if (e.getCause() instanceof RuntimeException) {
                        throw (RuntimeException) e.getCause();
                    }
                    throw e;
                }
            })
            .collect(Collectors.toList());
    }

    /**
     * Shuts the pool down; a later {@link #getExecutor()} creates a new one.
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
