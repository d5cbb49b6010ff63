package br.edu.ifba.mindgraph.extraction;

import br.edu.ifba.mindgraph.core.ExtractionErrorKind;
import br.edu.ifba.mindgraph.core.ExtractionLogEntry;
import br.edu.ifba.mindgraph.core.ExtractionStatus;
import br.edu.ifba.mindgraph.shared.UuidUtils;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.utils.Futures;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs extraction in the background on a bounded pool.
 *
 * <p>Turns wait in a queue of fixed capacity. When the queue is full the turn
 * is not processed: the rejection is logged, counted and recorded as a REJECTED
 * extraction log entry, and the returned future completes immediately.</p>
 */
@ApplicationScoped
public class ExtractionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionScheduler.class);

    private final ExtractionPipeline pipeline;
    private final GraphStore store;
    private final ThreadPoolExecutor executor;
    private final int workers;
    private final int queueCapacity;
    private final Duration shutdownGrace;
    private final Clock clock;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    /**
     * Default constructor for CDI proxy.
     */
    public ExtractionScheduler() {
        this.pipeline = null;
        this.store = null;
        this.executor = null;
        this.workers = 0;
        this.queueCapacity = 0;
        this.shutdownGrace = null;
        this.clock = null;
    }

    @Inject
    public ExtractionScheduler(ExtractionPipeline pipeline, GraphStore store, ExtractionConfig config) {
        this(pipeline, store, config.workers(), config.queueCapacity(), config.shutdownGrace(), Clock.systemUTC());
    }

    public ExtractionScheduler(ExtractionPipeline pipeline, GraphStore store, int workers, int queueCapacity,
                               Duration shutdownGrace, Clock clock) {
        this.pipeline = pipeline;
        this.store = store;
        this.workers = workers;
        this.queueCapacity = queueCapacity;
        this.shutdownGrace = shutdownGrace;
        this.clock = clock;
        this.executor = new ThreadPoolExecutor(
            workers, workers,
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            workerThreads(),
            new ThreadPoolExecutor.AbortPolicy());
        logger.info("Extraction scheduler started with {} workers and queue capacity {}", workers, queueCapacity);
    }

    /**
     * Queues a turn for extraction.
     *
     * @return a future completing with the run's result, or immediately with a
     *         REJECTED result when the queue is full or the scheduler is stopping
     */
    @NotNull
    public CompletableFuture<ExtractionResult> submit(@NotNull ConversationTurn turn) {
        CompletableFuture<ExtractionResult> result = new CompletableFuture<>();
        try {
            executor.execute(() -> runTurn(turn, result));
            submitted.incrementAndGet();
        } catch (RejectedExecutionException e) {
            rejected.incrementAndGet();
            String reason = executor.isShutdown()
                ? "Extraction scheduler is shutting down"
                : "Extraction queue is full (" + queueCapacity + " turns waiting)";
            logger.warn("Rejected turn {} for profile {}: {}", turn.turnId(), turn.profileId(), reason);
            ExtractionError error = new ExtractionError(ExtractionErrorKind.QUEUE_FULL, reason);
            recordRejection(turn, error);
            result.complete(ExtractionResult.rejected(turn.turnId(), error));
        }
        return result;
    }

    private void runTurn(ConversationTurn turn, CompletableFuture<ExtractionResult> result) {
        try {
            ExtractionResult outcome = pipeline.extract(turn);
            if (outcome.status() == ExtractionStatus.FAILED) {
                failed.incrementAndGet();
            } else {
                completed.incrementAndGet();
            }
            result.complete(outcome);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            logger.error("Extraction worker failed for turn {}", turn.turnId(), e);
            result.completeExceptionally(e);
        }
    }

    private void recordRejection(ConversationTurn turn, ExtractionError error) {
        ExtractionLogEntry entry = new ExtractionLogEntry(UuidUtils.newId(), turn.profileId(), turn.turnId(),
            turn.text(), null, List.of(), List.of(), ExtractionStatus.REJECTED, error.kind(), error.message(),
            List.of(), 0L, clock.instant().truncatedTo(ChronoUnit.MILLIS));
        try {
            Futures.await(store.appendExtractionLog(entry));
        } catch (RuntimeException e) {
            logger.error("Could not record rejected turn {}", turn.turnId(), e);
        }
    }

    @NotNull
    public ExtractionQueueStats stats() {
        return new ExtractionQueueStats(
            submitted.get(),
            completed.get(),
            failed.get(),
            rejected.get(),
            executor.getQueue().size(),
            executor.getActiveCount(),
            workers,
            queueCapacity);
    }

    /**
     * Stops intake and waits up to the grace period for queued and running turns.
     */
    @PreDestroy
    public void shutdown() {
        if (executor == null || executor.isShutdown()) {
            return;
        }
        logger.info("Shutting down extraction scheduler ({} queued, {} active)",
            executor.getQueue().size(), executor.getActiveCount());
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = executor.shutdownNow();
                logger.warn("Extraction scheduler did not drain within {} ms; {} queued turns dropped",
                    shutdownGrace.toMillis(), dropped.size());
            } else {
                logger.info("Extraction scheduler shut down cleanly");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, "extraction-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
