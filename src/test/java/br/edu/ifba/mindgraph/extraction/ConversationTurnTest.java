package br.edu.ifba.mindgraph.extraction;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConversationTurnTest {

    @Test
    void testBlankTurnIdIsGenerated() {
        ConversationTurn turn = new ConversationTurn("  ", "user-1", "hello", null, null, Instant.now());

        assertFalse(turn.turnId().isBlank());
        assertEquals(ConversationType.CHAT, turn.conversationType());
        assertEquals(List.of(), turn.recentTurns());
    }

    @Test
    void testBlankTextIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConversationTurn.of("user-1", "   ", null));
    }

    @Test
    void testInvalidProfileIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConversationTurn.of("", "hello", null));
    }

    @Test
    void testContextWindowKeepsMostRecentTurns() {
        ConversationTurn turn = ConversationTurn.of("user-1", "now", List.of("a", "b", "c", "d"));

        assertEquals(List.of("c", "d"), turn.contextWindow(2));
        assertEquals(List.of("a", "b", "c", "d"), turn.contextWindow(10));
        assertEquals(List.of(), turn.contextWindow(0));
    }
}
