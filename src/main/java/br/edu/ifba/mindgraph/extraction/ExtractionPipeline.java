package br.edu.ifba.mindgraph.extraction;

import br.edu.ifba.mindgraph.core.ExtractionErrorKind;
import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.ExtractionLogEntry;
import br.edu.ifba.mindgraph.core.ExtractionStatus;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.resolve.EdgeResolution;
import br.edu.ifba.mindgraph.resolve.EntityResolution;
import br.edu.ifba.mindgraph.resolve.EntityResolver;
import br.edu.ifba.mindgraph.resolve.RelationResolver;
import br.edu.ifba.mindgraph.shared.UuidUtils;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.understanding.MalformedUnderstandingException;
import br.edu.ifba.mindgraph.understanding.TextUnderstandingException;
import br.edu.ifba.mindgraph.understanding.TextUnderstandingService;
import br.edu.ifba.mindgraph.understanding.UnderstandingResponseParser;
import br.edu.ifba.mindgraph.understanding.UnderstandingResult;
import br.edu.ifba.mindgraph.utils.Futures;
import br.edu.ifba.mindgraph.utils.LockUtil;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns one conversation turn into graph updates.
 *
 * <p>A run calls the text-understanding service under a deadline, validates the
 * response, resolves entities and then relations, and appends exactly one
 * extraction log entry as its last step. Run-level failures are recorded as a
 * FAILED entry and returned; they are never thrown to the caller.</p>
 *
 * <p>A turn that already has a SUCCEEDED entry is not processed again. Runs of the
 * same turn are serialized on a per-turn lock, so an overlapping replay sees the
 * first run's entry and is skipped.</p>
 */
@ApplicationScoped
public class ExtractionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionPipeline.class);

    static final String MDC_PROFILE_ID = "profile.id";
    static final String MDC_TURN_ID = "turn.id";

    private final GraphStore store;
    private final TextUnderstandingService understanding;
    private final UnderstandingResponseParser parser;
    private final EntityResolver entityResolver;
    private final RelationResolver relationResolver;
    private final Duration understandingTimeout;
    private final int contextWindowTurns;
    private final Clock clock;

    /**
     * Default constructor for CDI proxy.
     */
    public ExtractionPipeline() {
        this.store = null;
        this.understanding = null;
        this.parser = null;
        this.entityResolver = null;
        this.relationResolver = null;
        this.understandingTimeout = null;
        this.contextWindowTurns = 0;
        this.clock = null;
    }

    @Inject
    public ExtractionPipeline(GraphStore store, TextUnderstandingService understanding,
                              UnderstandingResponseParser parser, EntityResolver entityResolver,
                              RelationResolver relationResolver, ExtractionConfig config) {
        this(store, understanding, parser, entityResolver, relationResolver,
            config.understandingTimeout(), config.contextWindowTurns(), Clock.systemUTC());
    }

    public ExtractionPipeline(GraphStore store, TextUnderstandingService understanding,
                              UnderstandingResponseParser parser, EntityResolver entityResolver,
                              RelationResolver relationResolver, Duration understandingTimeout,
                              int contextWindowTurns, Clock clock) {
        this.store = store;
        this.understanding = understanding;
        this.parser = parser;
        this.entityResolver = entityResolver;
        this.relationResolver = relationResolver;
        this.understandingTimeout = understandingTimeout;
        this.contextWindowTurns = contextWindowTurns;
        this.clock = clock;
    }

    /**
     * Extracts a turn that has no caller-supplied id.
     */
    @NotNull
    public ExtractionResult extract(@NotNull String profileId, @NotNull String turnText,
                                    @Nullable List<String> conversationContext) {
        return extract(ConversationTurn.of(profileId, turnText, conversationContext));
    }

    @NotNull
    public ExtractionResult extract(@NotNull ConversationTurn turn) {
        MDC.put(MDC_PROFILE_ID, turn.profileId());
        MDC.put(MDC_TURN_ID, turn.turnId());
        long startNanos = System.nanoTime();
        try {
            return LockUtil.withLock(turnKey(turn), () -> run(turn, startNanos));
        } catch (RuntimeException e) {
            logger.error("Extraction run failed unexpectedly", e);
            ExtractionError error = new ExtractionError(ExtractionErrorKind.INTERNAL, describe(e));
            appendFailure(turn, null, error, elapsedMillis(startNanos));
            return ExtractionResult.failed(turn.turnId(), error, elapsedMillis(startNanos));
        } finally {
            MDC.remove(MDC_PROFILE_ID);
            MDC.remove(MDC_TURN_ID);
        }
    }

    private ExtractionResult run(ConversationTurn turn, long startNanos) {
        Optional<ExtractionLogEntry> previous = Futures.await(
            store.findSuccessfulLog(turn.profileId(), turn.turnId()));
        if (previous.isPresent()) {
            logger.info("Turn already extracted by run {}, skipping", previous.get().id());
            long duration = elapsedMillis(startNanos);
            append(entry(turn, ExtractionStatus.SKIPPED_DUPLICATE, null, List.of(), List.of(),
                null, List.of(), duration));
            return ExtractionResult.skipped(turn.turnId(), duration);
        }

        String raw;
        try {
            raw = callUnderstanding(turn);
        } catch (TextUnderstandingException e) {
            logger.warn("Text understanding unavailable: {}", e.getMessage());
            return fail(turn, null, ExtractionErrorKind.EXTRACTION_UNAVAILABLE, e.getMessage(), startNanos);
        } catch (MalformedUnderstandingException e) {
            logger.warn("Text understanding returned an unusable answer: {}", e.getMessage());
            return fail(turn, null, ExtractionErrorKind.MALFORMED_RESPONSE, e.getMessage(), startNanos);
        }

        UnderstandingResult understood;
        try {
            understood = parser.parse(raw);
        } catch (MalformedUnderstandingException e) {
            logger.warn("Malformed understanding response: {}", e.getMessage());
            return fail(turn, raw, ExtractionErrorKind.MALFORMED_RESPONSE, e.getMessage(), startNanos);
        }

        EntityResolution entities = entityResolver.resolve(turn.profileId(), understood.entities());
        EdgeResolution edges = understood.relations().isEmpty()
            ? EdgeResolution.empty()
            : relationResolver.resolve(turn.profileId(), understood.relations(), entities);

        List<ExtractionIssue> issues = new ArrayList<>(understood.droppedItems());
        issues.addAll(entities.issues());
        issues.addAll(edges.issues());

        long duration = elapsedMillis(startNanos);
        append(entry(turn, ExtractionStatus.SUCCEEDED, raw, entities.nodes(), edges.edges(),
            null, issues, duration));
        logger.info("Extraction succeeded: {} nodes, {} edges, {} issues in {} ms",
            entities.nodes().size(), edges.edges().size(), issues.size(), duration);
        return ExtractionResult.succeeded(turn.turnId(), entities.nodes(), edges.edges(), issues, duration);
    }

    /**
     * Calls the understanding service and waits at most the configured deadline.
     * Failures of the call surface as {@link TextUnderstandingException} or
     * {@link MalformedUnderstandingException}.
     */
    private String callUnderstanding(ConversationTurn turn) {
        CompletableFuture<String> future;
        try {
            future = understanding.understand(turn.text(), turn.contextWindow(contextWindowTurns));
        } catch (TextUnderstandingException | MalformedUnderstandingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TextUnderstandingException("Understanding call could not start: " + describe(e), e);
        }

        try {
            return future.get(understandingTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TextUnderstandingException("Understanding call timed out after " + understandingTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TextUnderstandingException("Interrupted while waiting for understanding", e);
        } catch (ExecutionException e) {
            RuntimeException cause = Futures.unwrap(e);
            if (cause instanceof TextUnderstandingException || cause instanceof MalformedUnderstandingException) {
                throw cause;
            }
            throw new TextUnderstandingException("Understanding call failed: " + describe(cause), cause);
        }
    }

    private ExtractionResult fail(ConversationTurn turn, @Nullable String raw, ExtractionErrorKind kind,
                                  @Nullable String message, long startNanos) {
        ExtractionError error = new ExtractionError(kind, message);
        long duration = elapsedMillis(startNanos);
        appendFailure(turn, raw, error, duration);
        return ExtractionResult.failed(turn.turnId(), error, duration);
    }

    /**
     * Appends a FAILED entry. A storage failure here is logged and not rethrown,
     * since the run is already being reported as failed.
     */
    private void appendFailure(ConversationTurn turn, @Nullable String raw, ExtractionError error, long duration) {
        ExtractionLogEntry failed = new ExtractionLogEntry(UuidUtils.newId(), turn.profileId(), turn.turnId(),
            turn.text(), raw, List.of(), List.of(), ExtractionStatus.FAILED, error.kind(), error.message(),
            List.of(), duration, clock.instant().truncatedTo(ChronoUnit.MILLIS));
        try {
            append(failed);
        } catch (RuntimeException e) {
            logger.error("Could not record failed extraction run {} ({})", failed.id(), error.kind(), e);
        }
    }

    private ExtractionLogEntry entry(ConversationTurn turn, ExtractionStatus status, @Nullable String raw,
                                     List<KnowledgeNode> nodes, List<KnowledgeEdge> edges,
                                     @Nullable ExtractionError error, List<ExtractionIssue> issues, long duration) {
        return new ExtractionLogEntry(
            UuidUtils.newId(),
            turn.profileId(),
            turn.turnId(),
            turn.text(),
            raw,
            nodes.stream().map(KnowledgeNode::getId).toList(),
            edges.stream().map(KnowledgeEdge::getId).toList(),
            status,
            error != null ? error.kind() : null,
            error != null ? error.message() : null,
            issues,
            duration,
            clock.instant().truncatedTo(ChronoUnit.MILLIS));
    }

    private void append(ExtractionLogEntry entry) {
        Futures.await(store.appendExtractionLog(entry));
    }

    static String turnKey(ConversationTurn turn) {
        return "turn::" + turn.profileId() + "::" + turn.turnId();
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
