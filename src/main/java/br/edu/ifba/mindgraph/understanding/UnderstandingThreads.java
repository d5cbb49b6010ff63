package br.edu.ifba.mindgraph.understanding;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool for blocking REST client calls. Each thread carries the application
 * class loader so the client and Jackson resolve classes as on a Quarkus worker.
 *
 * <p>A call that times out in the pipeline keeps its thread until the client
 * returns, so the pool and its queue are capped. Submitting past both throws
 * {@link java.util.concurrent.RejectedExecutionException}.</p>
 *
 * <pre>
 * mindgraph.understanding.max-concurrent-calls=4
 * mindgraph.understanding.max-pending-calls=16
 * </pre>
 */
@ApplicationScoped
public class UnderstandingThreads {

    private static final Logger LOG = Logger.getLogger(UnderstandingThreads.class);

    private static final ClassLoader APP_CLASSLOADER = UnderstandingThreads.class.getClassLoader();
    private static final AtomicInteger COUNTER = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = task -> {
        Thread thread = new Thread(() -> {
            Thread.currentThread().setContextClassLoader(APP_CLASSLOADER);
            task.run();
        }, "understanding-" + COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    private final ThreadPoolExecutor executor;

    /**
     * Default constructor for CDI proxy.
     */
    UnderstandingThreads() {
        this.executor = null;
    }

    @Inject
    public UnderstandingThreads(
            @ConfigProperty(name = "mindgraph.understanding.max-concurrent-calls", defaultValue = "4") int maxConcurrentCalls,
            @ConfigProperty(name = "mindgraph.understanding.max-pending-calls", defaultValue = "16") int maxPendingCalls) {
        if (maxConcurrentCalls < 1 || maxPendingCalls < 1) {
            throw new IllegalArgumentException("understanding pool limits must be positive, got "
                + maxConcurrentCalls + "/" + maxPendingCalls);
        }
        this.executor = new ThreadPoolExecutor(maxConcurrentCalls, maxConcurrentCalls, 30, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(maxPendingCalls), THREAD_FACTORY, new ThreadPoolExecutor.AbortPolicy());
        this.executor.allowCoreThreadTimeOut(true);
        LOG.infof("Understanding pool ready: %d concurrent calls, %d pending",
            Integer.valueOf(maxConcurrentCalls), Integer.valueOf(maxPendingCalls));
    }

    public ExecutorService executor() {
        return executor;
    }

    int activeCalls() {
        return executor.getActiveCount();
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
        LOG.debug("Understanding pool shut down");
    }
}
