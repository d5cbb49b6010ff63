package br.edu.ifba.mindgraph.resolve;

import br.edu.ifba.mindgraph.core.EntityCandidate;
import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.ExtractionIssue;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.core.NodeProperties;
import br.edu.ifba.mindgraph.shared.ProfileIds;
import br.edu.ifba.mindgraph.shared.UuidUtils;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.StorageConflictException;
import br.edu.ifba.mindgraph.utils.Futures;
import br.edu.ifba.mindgraph.utils.LockUtil;
import br.edu.ifba.mindgraph.utils.RetryEventLogger;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
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
 * Merges entity candidates into a profile's graph.
 *
 * <p>Candidates are canonicalized and grouped by (type, canonical name), so
 * duplicates within one batch become a single write that counts as one mention.
 * A hit increments the mention count, refreshes {@code lastMentioned}, updates
 * confidence through the {@link ConfidencePolicy} and merges properties with the
 * new values winning. A miss creates the node.</p>
 *
 * <p>Each (profile, type, canonical name) is written under its own lock and
 * the store's version check. A version conflict is retried once against a fresh
 * read; a second conflict abandons that entity with a STORAGE_CONFLICT issue.</p>
 */
@ApplicationScoped
public class EntityResolver {

    private static final Logger logger = LoggerFactory.getLogger(EntityResolver.class);

    static final int MAX_ATTEMPTS = 2;

    private final GraphStore store;
    private final NameCanonicalizer canonicalizer;
    private final ConfidencePolicy confidencePolicy;
    private final RetryEventLogger retryLogger;
    private final double minConfidence;
    private final Clock clock;

    /**
     * Default constructor for CDI proxy.
     */
    public EntityResolver() {
        this.store = null;
        this.canonicalizer = null;
        this.confidencePolicy = null;
        this.retryLogger = null;
        this.minConfidence = 0.0;
        this.clock = null;
    }

    @Inject
    public EntityResolver(GraphStore store, NameCanonicalizer canonicalizer, ConfidencePolicy confidencePolicy,
                          RetryEventLogger retryLogger, ResolutionConfig config) {
        this(store, canonicalizer, confidencePolicy, retryLogger, config.minConfidence(), Clock.systemUTC());
    }

    public EntityResolver(GraphStore store, NameCanonicalizer canonicalizer, ConfidencePolicy confidencePolicy,
                          RetryEventLogger retryLogger, double minConfidence, Clock clock) {
        this.store = store;
        this.canonicalizer = canonicalizer;
        this.confidencePolicy = confidencePolicy;
        this.retryLogger = retryLogger;
        this.minConfidence = minConfidence;
        this.clock = clock;
    }

    /**
     * Resolves a batch of candidates against the profile's nodes.
     *
     * @param profileId the owning profile
     * @param candidates candidates from one extraction run
     * @return resolved nodes, a canonical-name index for relation resolution, and skipped candidates
     */
    @NotNull
    public EntityResolution resolve(@NotNull String profileId, @NotNull List<EntityCandidate> candidates) {
        ProfileIds.requireValid(profileId);
        if (candidates.isEmpty()) {
            return EntityResolution.empty();
        }

        List<ExtractionIssue> issues = new ArrayList<>();
        Map<String, MergedCandidate> groups = new LinkedHashMap<>();
        for (EntityCandidate candidate : candidates) {
            String canonical = canonicalizer.canonicalize(candidate.name());
            if (canonical.isEmpty()) {
                issues.add(ExtractionIssue.ambiguous(
                    "Entity name '" + candidate.name() + "' has no meaningful content"));
                continue;
            }
            if (candidate.confidence() < minConfidence) {
                issues.add(ExtractionIssue.ambiguous(String.format(Locale.ROOT, 
                    "Entity '%s' confidence %.2f below minimum %.2f", candidate.name(), candidate.confidence(), minConfidence)));
                continue;
            }
            String groupKey = candidate.type().name() + "::" + canonical;
            NodeProperties properties = NodeProperties.of(candidate.type(), candidate.properties());
            groups.merge(groupKey,
                new MergedCandidate(candidate.type(), canonical, candidate.name().trim(), candidate.confidence(), properties),
                MergedCandidate::absorb);
        }

        List<KnowledgeNode> resolved = new ArrayList<>(groups.size());
        for (MergedCandidate merged : groups.values()) {
            resolveOne(profileId, merged).ifPresentOrElse(resolved::add, () -> issues.add(
                ExtractionIssue.storageConflict("Entity " + merged.type + " '" + merged.canonicalName
                    + "' abandoned after " + MAX_ATTEMPTS + " conflicting writes")));
        }

        logger.debug("Resolved {} candidates into {} nodes for profile {} ({} issues)",
            candidates.size(), resolved.size(), profileId, issues.size());
        return EntityResolution.of(resolved, issues);
    }

    private Optional<KnowledgeNode> resolveOne(String profileId, MergedCandidate merged) {
        String key = KnowledgeNode.identityKey(profileId, merged.type, merged.canonicalName);
        return LockUtil.withLock(key, () -> {
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                try {
                    KnowledgeNode written = writeOnce(profileId, merged);
                    retryLogger.logRetrySuccess("upsertNode(" + key + ")", attempt);
                    return Optional.of(written);
                } catch (StorageConflictException e) {
                    if (attempt < MAX_ATTEMPTS) {
                        retryLogger.logRetryAttempt("upsertNode(" + key + ")", attempt + 1, MAX_ATTEMPTS, e);
                    } else {
                        retryLogger.logRetryExhausted("upsertNode(" + key + ")", attempt, e);
                    }
                }
            }
            return Optional.<KnowledgeNode>empty();
        });
    }

    private KnowledgeNode writeOnce(String profileId, MergedCandidate merged) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Optional<KnowledgeNode> existing = Futures.await(store.findNode(profileId, merged.type, merged.canonicalName));

        KnowledgeNode next;
        if (existing.isPresent()) {
            KnowledgeNode current = existing.get();
            next = current.toBuilder()
                .confidence(confidencePolicy.update(current.getConfidence(), merged.confidence))
                .mentionCount(current.getMentionCount() + 1)
                .lastMentioned(now.isAfter(current.getLastMentioned()) ? now : current.getLastMentioned())
                .properties(current.getProperties().mergedWith(merged.properties))
                .build();
        } else {
            next = KnowledgeNode.builder()
                .id(UuidUtils.newId())
                .profileId(profileId)
                .entityType(merged.type)
                .entityName(merged.displayName)
                .canonicalName(merged.canonicalName)
                .properties(merged.properties)
                .confidence(ConfidencePolicy.clamp(merged.confidence))
                .mentionCount(1)
                .lastMentioned(now)
                .createdAt(now)
                .build();
        }
        return Futures.await(store.upsertNode(next));
    }

    /**
     * All candidates of one batch sharing a (type, canonical name).
     */
    private static final class MergedCandidate {
        final EntityType type;
        final String canonicalName;
        final String displayName;
        final double confidence;
        final NodeProperties properties;

        MergedCandidate(EntityType type, String canonicalName, String displayName, double confidence,
                        NodeProperties properties) {
            this.type = type;
            this.canonicalName = canonicalName;
            this.displayName = displayName;
            this.confidence = confidence;
            this.properties = properties;
        }

        MergedCandidate absorb(MergedCandidate later) {
            return new MergedCandidate(type, canonicalName, displayName,
                Math.max(confidence, later.confidence), properties.mergedWith(later.properties));
        }
    }
}
