package br.edu.ifba.mindgraph.retrieval;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.core.NodeProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextWindowTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private static ScoredNode scored(String id, EntityType type, String name, int mentions, NodeProperties properties) {
        KnowledgeNode node = KnowledgeNode.builder()
            .id(id)
            .profileId("user-1")
            .entityType(type)
            .entityName(name)
            .canonicalName(name.toLowerCase())
            .properties(properties)
            .confidence(0.9)
            .mentionCount(mentions)
            .lastMentioned(NOW)
            .build();
        return new ScoredNode(node, 0.5, 0.0, 1.0, 0.5, false);
    }

    @Test
    void testRenderListsNodesAndRelationships() {
        ScoredNode sarah = scored("n1", EntityType.PERSON, "Sarah", 5,
            NodeProperties.of(EntityType.PERSON, Map.of("relationship", "friend")));
        ScoredNode happy = scored("n2", EntityType.EMOTION, "happy", 1, NodeProperties.empty());
        KnowledgeEdge edge = KnowledgeEdge.builder()
            .id("e1")
            .profileId("user-1")
            .sourceNodeId("n1")
            .targetNodeId("n2")
            .relationshipType("made_feel")
            .confidence(0.7)
            .lastUpdated(NOW)
            .build();

        String text = new ContextWindow("user-1", List.of(sarah, happy), List.of(edge), false).render();

        assertEquals("""
            Known about the user:
            - Sarah (person, mentioned 5 times); relationship: friend
            - happy (emotion)
            Relationships:
            - Sarah made feel happy""", text);
    }

    @Test
    void testRenderWithoutEdgesOmitsRelationships() {
        ScoredNode yoga = scored("n1", EntityType.ACTIVITY, "yoga", 2, NodeProperties.empty());

        String text = new ContextWindow("user-1", List.of(yoga), List.of(), false).render();

        assertEquals("Known about the user:\n- yoga (activity, mentioned 2 times)", text);
    }

    @Test
    void testEmptyAndDegradedWindowsRenderNothing() {
        assertEquals("", ContextWindow.empty("user-1").render());
        assertTrue(ContextWindow.degraded("user-1").degraded());
        assertTrue(ContextWindow.degraded("user-1").isEmpty());
    }
}
