package br.edu.ifba.mindgraph.extraction;

import br.edu.ifba.mindgraph.core.ExtractionErrorKind;
import br.edu.ifba.mindgraph.core.ExtractionLogEntry;
import br.edu.ifba.mindgraph.core.ExtractionStatus;
import br.edu.ifba.mindgraph.storage.impl.InMemoryGraphStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ExtractionScheduler}: bounded queue, rejection and counters.
 */
class ExtractionSchedulerTest {

    private static final String PROFILE = "user-1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private InMemoryGraphStore store;
    private ExtractionPipeline pipeline;
    private CountDownLatch release;
    private ExtractionScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.initialize().join();
        release = new CountDownLatch(1);
        pipeline = mock(ExtractionPipeline.class);
        when(pipeline.extract(any(ConversationTurn.class))).thenAnswer(invocation -> {
            ConversationTurn turn = invocation.getArgument(0);
            release.await(5, TimeUnit.SECONDS);
            return ExtractionResult.succeeded(turn.turnId(), List.of(), List.of(), List.of(), 1L);
        });
        scheduler = new ExtractionScheduler(pipeline, store, 1, 1, Duration.ofSeconds(5), CLOCK);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        scheduler.shutdown();
        store.close();
    }

    private ConversationTurn turn(String turnId) {
        return new ConversationTurn(turnId, PROFILE, "I went for a walk", ConversationType.CHAT, List.of(), CLOCK.instant());
    }

    @Test
    void testSubmittedTurnCompletes() throws Exception {
        release.countDown();

        ExtractionResult result = scheduler.submit(turn("t-1")).get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("t-1", result.turnId());
    }

    @Test
    void testFullQueueRejectsTurn() throws Exception {
        CompletableFuture<ExtractionResult> running = scheduler.submit(turn("t-1"));
        CompletableFuture<ExtractionResult> queued = scheduler.submit(turn("t-2"));
        CompletableFuture<ExtractionResult> overflow = scheduler.submit(turn("t-3"));

        assertTrue(overflow.isDone(), "Rejection must not wait for a worker");
        ExtractionResult rejected = overflow.get();
        assertEquals(ExtractionStatus.REJECTED, rejected.status());
        assertEquals(ExtractionErrorKind.QUEUE_FULL, rejected.error().kind());

        List<ExtractionLogEntry> logs = store.listExtractionLogs(PROFILE, 10).join();
        assertEquals(1, logs.size());
        assertEquals(ExtractionStatus.REJECTED, logs.get(0).status());
        assertEquals("t-3", logs.get(0).turnId());

        release.countDown();
        assertTrue(running.get(5, TimeUnit.SECONDS).isSuccess());
        assertTrue(queued.get(5, TimeUnit.SECONDS).isSuccess());
    }

    @Test
    void testStatsCountOutcomes() throws Exception {
        CompletableFuture<ExtractionResult> first = scheduler.submit(turn("t-1"));
        CompletableFuture<ExtractionResult> second = scheduler.submit(turn("t-2"));
        scheduler.submit(turn("t-3"));

        ExtractionQueueStats busy = scheduler.stats();
        assertEquals(2, busy.submitted());
        assertEquals(1, busy.rejected());
        assertEquals(1, busy.workers());
        assertEquals(1, busy.queueCapacity());

        release.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        assertEquals(2, scheduler.stats().completed());
        assertEquals(0, scheduler.stats().failed());
    }

    @Test
    void testSubmitAfterShutdownIsRejected() throws Exception {
        release.countDown();
        scheduler.shutdown();

        ExtractionResult result = scheduler.submit(turn("t-9")).get();

        assertEquals(ExtractionStatus.REJECTED, result.status());
        assertTrue(result.error().message().contains("shutting down"));
    }

    @Test
    void testShutdownDrainsQueuedTurns() throws Exception {
        CompletableFuture<ExtractionResult> running = scheduler.submit(turn("t-1"));
        CompletableFuture<ExtractionResult> queued = scheduler.submit(turn("t-2"));

        release.countDown();
        scheduler.shutdown();

        assertTrue(running.isDone());
        assertTrue(queued.get().isSuccess());
    }
}
