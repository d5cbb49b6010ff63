package br.edu.ifba.mindgraph.retrieval;

import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.resolve.NameCanonicalizer;
import br.edu.ifba.mindgraph.shared.ProfileIds;
import br.edu.ifba.mindgraph.storage.EdgeFilter;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.NodeFilter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Selects the part of a profile's graph that is relevant to the message being answered.
 *
 * <p>Candidates come only from indexed lookups: canonical names matching the
 * message's n-grams, the most recently mentioned nodes and the most salient
 * nodes. Candidates are ranked by {@link RelevanceScorer}; the top
 * {@code maxNodes} are returned with the edges among them.</p>
 *
 * <p>Retrieval is read-only and takes no write locks. Store failures and the
 * deadline both produce an empty window instead of an error.</p>
 */
@ApplicationScoped
public class ContextRetriever {

    private static final Logger logger = LoggerFactory.getLogger(ContextRetriever.class);

    private final GraphStore store;
    private final NameCanonicalizer canonicalizer;
    private final RelevanceScorer scorer;
    private final int defaultMaxNodes;
    private final int maxNodesLimit;
    private final int candidatePool;
    private final Duration timeout;
    private final Clock clock;

    /**
     * Default constructor for CDI proxy.
     */
    public ContextRetriever() {
        this.store = null;
        this.canonicalizer = null;
        this.scorer = null;
        this.defaultMaxNodes = 0;
        this.maxNodesLimit = 0;
        this.candidatePool = 0;
        this.timeout = null;
        this.clock = null;
    }

    @Inject
    public ContextRetriever(GraphStore store, NameCanonicalizer canonicalizer, RetrievalConfig config) {
        this(store, canonicalizer,
            new RelevanceScorer(config.weights().lexical(), config.weights().recency(),
                config.weights().salience(), config.recencyHalfLife()),
            config.defaultMaxNodes(), config.maxNodesLimit(), config.candidatePool(), config.timeout(),
            Clock.systemUTC());
    }

    public ContextRetriever(GraphStore store, NameCanonicalizer canonicalizer, RelevanceScorer scorer,
                            int defaultMaxNodes, int maxNodesLimit, int candidatePool, Duration timeout, Clock clock) {
        this.store = store;
        this.canonicalizer = canonicalizer;
        this.scorer = scorer;
        this.defaultMaxNodes = defaultMaxNodes;
        this.maxNodesLimit = maxNodesLimit;
        this.candidatePool = candidatePool;
        this.timeout = timeout;
        this.clock = clock;
    }

    @NotNull
    public ContextWindow retrieveContext(@NotNull String profileId, @Nullable String currentMessageText) {
        return retrieveContext(profileId, currentMessageText, defaultMaxNodes);
    }

    /**
     * Retrieves at most {@code maxNodes} nodes (capped by the configured limit)
     * and the subgraph they induce.
     *
     * @throws IllegalArgumentException for an invalid profile id or a non-positive maxNodes
     */
    @NotNull
    public ContextWindow retrieveContext(@NotNull String profileId, @Nullable String currentMessageText, int maxNodes) {
        ProfileIds.requireValid(profileId);
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be positive, got " + maxNodes);
        }
        int limit = Math.min(maxNodes, maxNodesLimit);
        long startNanos = System.nanoTime();

        CompletableFuture<ContextWindow> window;
        try {
            window = select(profileId, MessageTerms.of(currentMessageText, canonicalizer), limit);
        } catch (RuntimeException e) {
            logger.warn("Context retrieval failed for profile {}, returning empty context", profileId, e);
            return ContextWindow.degraded(profileId);
        }

        try {
            ContextWindow result = window.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            logger.debug("Retrieved {} nodes and {} edges for profile {} in {} ms",
                result.nodes().size(), result.edges().size(), profileId,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            return result;
        } catch (TimeoutException e) {
            window.cancel(true);
            logger.warn("Context retrieval for profile {} exceeded {} ms, returning empty context",
                profileId, timeout.toMillis());
            return ContextWindow.degraded(profileId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ContextWindow.degraded(profileId);
        } catch (ExecutionException e) {
            logger.warn("Context retrieval failed for profile {}, returning empty context", profileId, e.getCause());
            return ContextWindow.degraded(profileId);
        }
    }

    private CompletableFuture<ContextWindow> select(String profileId, MessageTerms terms, int limit) {
        CompletableFuture<List<KnowledgeNode>> named = terms.mentionedNames().isEmpty()
            ? CompletableFuture.completedFuture(List.of())
            : store.findNodesByCanonicalNames(profileId, terms.mentionedNames());
        CompletableFuture<List<KnowledgeNode>> recent = store.listNodes(profileId, NodeFilter.mostRecent(candidatePool));
        CompletableFuture<List<KnowledgeNode>> salient = store.listNodes(profileId, NodeFilter.mostSalient(candidatePool));

        return CompletableFuture.allOf(named, recent, salient)
            .thenCompose(ignored -> {
                Map<String, KnowledgeNode> candidates = new LinkedHashMap<>();
                addAll(candidates, named.join());
                addAll(candidates, recent.join());
                addAll(candidates, salient.join());
                if (candidates.isEmpty()) {
                    return CompletableFuture.completedFuture(ContextWindow.empty(profileId));
                }

                Instant now = clock.instant();
                List<ScoredNode> ranked = candidates.values().stream()
                    .map(node -> scorer.score(node, terms, now))
                    .sorted(RelevanceScorer.RANKING)
                    .limit(limit)
                    .toList();
                List<String> selectedIds = ranked.stream().map(scored -> scored.node().getId()).toList();

                return store.listEdges(profileId, EdgeFilter.between(selectedIds))
                    .thenApply(edges -> new ContextWindow(profileId, ranked, inducedEdges(edges, selectedIds), false));
            });
    }

    private static void addAll(Map<String, KnowledgeNode> candidates, Collection<KnowledgeNode> nodes) {
        for (KnowledgeNode node : nodes) {
            candidates.putIfAbsent(node.getId(), node);
        }
    }

    private static List<KnowledgeEdge> inducedEdges(List<KnowledgeEdge> edges, List<String> selectedIds) {
        return edges.stream()
            .filter(edge -> selectedIds.contains(edge.getSourceNodeId()) && selectedIds.contains(edge.getTargetNodeId()))
            .toList();
    }
}
