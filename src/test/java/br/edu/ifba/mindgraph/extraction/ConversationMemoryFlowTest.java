package br.edu.ifba.mindgraph.extraction;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.resolve.EntityResolver;
import br.edu.ifba.mindgraph.resolve.NameCanonicalizer;
import br.edu.ifba.mindgraph.resolve.RelationResolver;
import br.edu.ifba.mindgraph.resolve.RelationshipVocabulary;
import br.edu.ifba.mindgraph.resolve.WeightedRecencyConfidencePolicy;
import br.edu.ifba.mindgraph.retrieval.ContextRetriever;
import br.edu.ifba.mindgraph.retrieval.ContextWindow;
import br.edu.ifba.mindgraph.retrieval.RelevanceScorer;
import br.edu.ifba.mindgraph.retrieval.ScoredNode;
import br.edu.ifba.mindgraph.storage.impl.InMemoryGraphStore;
import br.edu.ifba.mindgraph.understanding.TextUnderstandingService;
import br.edu.ifba.mindgraph.understanding.UnderstandingResponseParser;
import br.edu.ifba.mindgraph.utils.LockUtil;
import br.edu.ifba.mindgraph.utils.RetryEventLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Two turns days apart are extracted and then recalled for a later message.
 */
class ConversationMemoryFlowTest {

    private static final String PROFILE = "user-42";
    private static final Instant LUNCH_DAY = Instant.parse("2026-03-01T13:00:00Z");

    private static final String LUNCH_TEXT = "I had lunch with Sarah today, she seemed happy";
    private static final String LUNCH_UNDERSTANDING = """
        {"entities": [
            {"type": "Person", "name": "Sarah", "confidence": 0.9},
            {"type": "Emotion", "name": "happy", "confidence": 0.8}
         ],
         "relations": [
            {"source": "Sarah", "target": "happy", "type": "experienced", "confidence": 0.8}
         ]}
        """;

    private static final String WORK_TEXT = "I'm anxious about work";
    private static final String WORK_UNDERSTANDING = """
        {"entities": [
            {"type": "Emotion", "name": "anxious", "confidence": 0.85},
            {"type": "Activity", "name": "work", "confidence": 0.9}
         ],
         "relations": [
            {"source": "work", "target": "anxious", "type": "causes", "confidence": 0.7}
         ]}
        """;

    private InMemoryGraphStore store;
    private TextUnderstandingService understanding;
    private SteppingClock clock;
    private ExtractionPipeline pipeline;
    private ContextRetriever retriever;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.initialize().join();
        LockUtil.clearLockPool();
        understanding = mock(TextUnderstandingService.class);
        clock = new SteppingClock(LUNCH_DAY);

        NameCanonicalizer canonicalizer = new NameCanonicalizer(Map.of());
        WeightedRecencyConfidencePolicy policy = new WeightedRecencyConfidencePolicy(0.4, 0.05);
        RelationshipVocabulary vocabulary = new RelationshipVocabulary(
            List.of("experienced", "causes", "enjoys"), Map.of("felt", "experienced"), true);
        EntityResolver entityResolver = new EntityResolver(store, canonicalizer, policy,
            new RetryEventLogger(), 0.2, clock);
        RelationResolver relationResolver = new RelationResolver(store, canonicalizer, vocabulary, policy,
            new RetryEventLogger(), 0.2, clock);
        pipeline = new ExtractionPipeline(store, understanding, new UnderstandingResponseParser(),
            entityResolver, relationResolver, Duration.ofSeconds(2), 5, clock);
        retriever = new ContextRetriever(store, canonicalizer,
            new RelevanceScorer(0.5, 0.3, 0.2, Duration.ofDays(7)),
            5, 20, 50, Duration.ofSeconds(2), clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Sarah and work are both recalled five days after they came up")
    void testSarahAndWorkRecalled() {
        when(understanding.understand(eq(LUNCH_TEXT), any()))
            .thenReturn(CompletableFuture.completedFuture(LUNCH_UNDERSTANDING));
        when(understanding.understand(eq(WORK_TEXT), any()))
            .thenReturn(CompletableFuture.completedFuture(WORK_UNDERSTANDING));

        ExtractionResult lunch = pipeline.extract(PROFILE, LUNCH_TEXT, List.of());
        assertTrue(lunch.isSuccess());
        assertEquals(1, lunch.edges().size());

        clock.advance(Duration.ofDays(5));
        ExtractionResult work = pipeline.extract(PROFILE, WORK_TEXT, List.of(LUNCH_TEXT));
        assertTrue(work.isSuccess());

        ContextWindow window = retriever.retrieveContext(PROFILE, "How's work going and how's Sarah?");

        assertFalse(window.degraded());
        List<String> names = window.knowledgeNodes().stream().map(KnowledgeNode::getEntityName).toList();
        assertTrue(names.contains("Sarah"), () -> "Sarah missing from " + names);
        assertTrue(names.contains("work"), () -> "work missing from " + names);
        assertTrue(window.nodes().stream()
            .filter(ScoredNode::explicitMention)
            .map(scored -> scored.node().getEntityName())
            .toList()
            .containsAll(List.of("Sarah", "work")));
        assertTrue(window.nodes().get(0).explicitMention());
        assertTrue(window.nodes().get(1).explicitMention());

        KnowledgeNode sarah = store.findNode(PROFILE, EntityType.PERSON, "sarah").join().orElseThrow();
        KnowledgeNode happy = store.findNode(PROFILE, EntityType.EMOTION, "happy").join().orElseThrow();
        assertEquals(LUNCH_DAY, sarah.getLastMentioned());
        KnowledgeEdge experienced = window.edges().stream()
            .filter(edge -> edge.getRelationshipType().equals("experienced"))
            .findFirst()
            .orElseThrow();
        assertEquals(sarah.getId(), experienced.getSourceNodeId());
        assertEquals(happy.getId(), experienced.getTargetNodeId());
    }

    @Test
    @DisplayName("A question about Sarah ranks her above a newer but minor activity")
    void testHowIsSarahDoing() {
        String sarahOnly = """
            {"entities": [{"type": "Person", "name": "Sarah", "confidence": 0.9}], "relations": []}
            """;
        String yogaOnly = """
            {"entities": [{"type": "Activity", "name": "yoga", "confidence": 0.9}], "relations": []}
            """;
        when(understanding.understand(eq("Sarah again"), any()))
            .thenReturn(CompletableFuture.completedFuture(sarahOnly));
        when(understanding.understand(eq("Tried yoga"), any()))
            .thenReturn(CompletableFuture.completedFuture(yogaOnly));

        for (int i = 0; i < 5; i++) {
            pipeline.extract(PROFILE, "Sarah again", List.of());
            clock.advance(Duration.ofHours(6));
        }
        pipeline.extract(PROFILE, "Tried yoga", List.of());

        assertEquals(5, store.findNode(PROFILE, EntityType.PERSON, "sarah").join().orElseThrow().getMentionCount());

        ContextWindow window = retriever.retrieveContext(PROFILE, "How is Sarah doing?");

        List<String> names = window.knowledgeNodes().stream().map(KnowledgeNode::getEntityName).toList();
        assertEquals(List.of("Sarah", "yoga"), names);
    }

    /**
     * Clock that moves only when told to.
     */
    private static final class SteppingClock extends Clock {

        private volatile Instant now;

        SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
