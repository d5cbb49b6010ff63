package br.edu.ifba.mindgraph.resolve;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.core.RelationCandidate;
import br.edu.ifba.mindgraph.shared.ProfileIds;
import br.edu.ifba.mindgraph.shared.UuidUtils;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.MissingEndpointException;
import br.edu.ifba.mindgraph.storage.StorageConflictException;
import br.edu.ifba.mindgraph.utils.Futures;
import br.edu.ifba.mindgraph.utils.LockUtil;
import br.edu.ifba.mindgraph.utils.RetryEventLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Merges relation candidates into edges between already-resolved nodes.
 *
 * <p>Mentions are mapped to nodes through the current batch first and the stored
 * graph second. A mention that maps to no node or to several nodes is skipped as
 * ambiguous. Self-loops, relationship types outside the vocabulary and endpoints
 * that disappeared before the write are rejected as invalid.</p>
 */
@ApplicationScoped
public class RelationResolver {

    private static final Logger logger = LoggerFactory.getLogger(RelationResolver.class);

    private final GraphStore store;
    private final NameCanonicalizer canonicalizer;
    private final RelationshipVocabulary vocabulary;
    private final ConfidencePolicy confidencePolicy;
    private final RetryEventLogger retryLogger;
    private final double minConfidence;
    private final Clock clock;

    /**
     * Default constructor for CDI proxy.
     */
    public RelationResolver() {
        this.store = null;
        this.canonicalizer = null;
        this.vocabulary = null;
        this.confidencePolicy = null;
        this.retryLogger = null;
        this.minConfidence = 0.0;
        this.clock = null;
    }

    @Inject
    public RelationResolver(GraphStore store, NameCanonicalizer canonicalizer, RelationshipVocabulary vocabulary,
                            ConfidencePolicy confidencePolicy, RetryEventLogger retryLogger, ResolutionConfig config) {
        this(store, canonicalizer, vocabulary, confidencePolicy, retryLogger, config.minConfidence(), Clock.systemUTC());
    }

    public RelationResolver(GraphStore store, NameCanonicalizer canonicalizer, RelationshipVocabulary vocabulary,
                            ConfidencePolicy confidencePolicy, RetryEventLogger retryLogger, double minConfidence,
                            Clock clock) {
        this.store = store;
        this.canonicalizer = canonicalizer;
        this.vocabulary = vocabulary;
        this.confidencePolicy = confidencePolicy;
        this.retryLogger = retryLogger;
        this.minConfidence = minConfidence;
        this.clock = clock;
    }

    /**
     * Resolves relation candidates against the profile's edges.
     *
     * @param profileId the owning profile
     * @param candidates relations from one extraction run
     * @param entities the entity resolution of the same run
     */
    @NotNull
    public EdgeResolution resolve(@NotNull String profileId, @NotNull List<RelationCandidate> candidates,
                                  @NotNull EntityResolution entities) {
        ProfileIds.requireValid(profileId);
        if (candidates.isEmpty()) {
            return EdgeResolution.empty();
        }

        List<ExtractionIssue> issues = new ArrayList<>();
        Map<String, PendingEdge> pending = new LinkedHashMap<>();
        for (RelationCandidate candidate : candidates) {
            String label = "'" + candidate.source() + "' -[" + candidate.type() + "]-> '" + candidate.target() + "'";

            Optional<String> type = vocabulary.resolve(candidate.type());
            if (type.isEmpty()) {
                issues.add(ExtractionIssue.invalidRelation("Unknown relationship type in " + label));
                continue;
            }
            if (candidate.confidence() < minConfidence) {
                issues.add(ExtractionIssue.ambiguous(String.format(Locale.ROOT,
                    "Relation %s confidence %.2f below minimum %.2f", label, candidate.confidence(), minConfidence)));
                continue;
            }
            MentionMatch source = matchMention(profileId, candidate.source(), candidate.sourceType(), entities);
            MentionMatch target = matchMention(profileId, candidate.target(), candidate.targetType(), entities);
            if (source.node == null || target.node == null) {
                String problem = source.node == null ? source.problem : target.problem;
                issues.add(ExtractionIssue.ambiguous(problem + " in " + label));
                continue;
            }
            if (source.node.getId().equals(target.node.getId())) {
                issues.add(ExtractionIssue.invalidRelation("Self-loop rejected: " + label));
                continue;
            }

            PendingEdge edge = new PendingEdge(source.node.getId(), target.node.getId(), type.get(),
                candidate.confidence(), label);
            pending.merge(edge.groupKey(), edge, PendingEdge::absorb);
        }

        List<KnowledgeEdge> resolved = new ArrayList<>(pending.size());
        for (PendingEdge edge : pending.values()) {
            writeWithRetry(profileId, edge, issues).ifPresent(resolved::add);
        }
        logger.debug("Resolved {} relation candidates into {} edges for profile {} ({} issues)",
            candidates.size(), resolved.size(), profileId, issues.size());
        return new EdgeResolution(resolved, issues);
    }

    private MentionMatch matchMention(String profileId, String mention, @Nullable EntityType typeHint,
                                      EntityResolution entities) {
        String canonical = canonicalizer.canonicalize(mention);
        if (canonical.isEmpty()) {
            return MentionMatch.problem("Empty mention '" + mention + "'");
        }
        List<KnowledgeNode> inBatch = entities.nodesFor(canonical, typeHint);
        if (inBatch.size() == 1) {
            return MentionMatch.of(inBatch.get(0));
        }
        if (inBatch.size() > 1) {
            return MentionMatch.problem("Mention '" + mention + "' matches " + inBatch.size() + " entities");
        }

        List<KnowledgeNode> stored = Futures.await(store.findNodesByCanonicalNames(profileId, List.of(canonical)))
            .stream()
            .filter(n -> typeHint == null || n.getEntityType() == typeHint)
            .toList();
        if (stored.size() == 1) {
            return MentionMatch.of(stored.get(0));
        }
        return MentionMatch.problem(stored.isEmpty()
            ? "Mention '" + mention + "' matches no known entity"
            : "Mention '" + mention + "' matches " + stored.size() + " entities");
    }

    private Optional<KnowledgeEdge> writeWithRetry(String profileId, PendingEdge edge, List<ExtractionIssue> issues) {
        String key = KnowledgeEdge.identityKey(profileId, edge.sourceId, edge.targetId, edge.type);
        return LockUtil.withLock(key, () -> {
            for (int attempt = 1; attempt <= EntityResolver.MAX_ATTEMPTS; attempt++) {
                try {
                    KnowledgeEdge written = writeOnce(profileId, edge);
                    retryLogger.logRetrySuccess("upsertEdge(" + key + ")", attempt);
                    return Optional.of(written);
                } catch (MissingEndpointException e) {
                    issues.add(ExtractionIssue.invalidRelation("Dangling endpoint for " + edge.label + ": " + e.getMessage()));
                    return Optional.<KnowledgeEdge>empty();
                } catch (StorageConflictException e) {
                    if (attempt < EntityResolver.MAX_ATTEMPTS) {
                        retryLogger.logRetryAttempt("upsertEdge(" + key + ")", attempt + 1, EntityResolver.MAX_ATTEMPTS, e);
                    } else {
                        retryLogger.logRetryExhausted("upsertEdge(" + key + ")", attempt, e);
                    }
                }
            }
            issues.add(ExtractionIssue.storageConflict("Relation " + edge.label + " abandoned after "
                + EntityResolver.MAX_ATTEMPTS + " conflicting writes"));
            return Optional.<KnowledgeEdge>empty();
        });
    }

    private KnowledgeEdge writeOnce(String profileId, PendingEdge edge) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Optional<KnowledgeEdge> existing = Futures.await(
            store.findEdge(profileId, edge.sourceId, edge.targetId, edge.type));

        KnowledgeEdge next;
        if (existing.isPresent()) {
            KnowledgeEdge current = existing.get();
            next = current.toBuilder()
                .confidence(confidencePolicy.update(current.getConfidence(), edge.confidence))
                .occurrences(current.getOccurrences() + 1)
                .lastUpdated(now.isAfter(current.getLastUpdated()) ? now : current.getLastUpdated())
                .build();
        } else {
            next = KnowledgeEdge.builder()
                .id(UuidUtils.newId())
                .profileId(profileId)
                .sourceNodeId(edge.sourceId)
                .targetNodeId(edge.targetId)
                .relationshipType(edge.type)
                .confidence(ConfidencePolicy.clamp(edge.confidence))
                .occurrences(1)
                .lastUpdated(now)
                .createdAt(now)
                .build();
        }
        return Futures.await(store.upsertEdge(next));
    }

    private static final class MentionMatch {
        final KnowledgeNode node;
        final String problem;

        private MentionMatch(KnowledgeNode node, String problem) {
            this.node = node;
            this.problem = problem;
        }

        static MentionMatch of(KnowledgeNode node) {
            return new MentionMatch(node, null);
        }

        static MentionMatch problem(String problem) {
            return new MentionMatch(null, problem);
        }
    }

    private static final class PendingEdge {
        final String sourceId;
        final String targetId;
        final String type;
        final double confidence;
        final String label;

        PendingEdge(String sourceId, String targetId, String type, double confidence, String label) {
            this.sourceId = sourceId;
            this.targetId = targetId;
            this.type = type;
            this.confidence = confidence;
            this.label = label;
        }

        String groupKey() {
            return sourceId + "::" + targetId + "::" + type;
        }

        PendingEdge absorb(PendingEdge later) {
            return new PendingEdge(sourceId, targetId, type, Math.max(confidence, later.confidence), label);
        }
    }
}
