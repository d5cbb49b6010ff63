package br.edu.ifba.mindgraph.extraction;

import br.edu.ifba.mindgraph.shared.ProfileIds;
import br.edu.ifba.mindgraph.shared.UuidUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One user utterance submitted for extraction.
 *
 * @param turnId caller-supplied id used for idempotence, generated when absent
 * @param profileId owning profile
 * @param text the utterance
 * @param conversationType chat or journal
 * @param recentTurns prior utterances, oldest first
 * @param recordedAt when the turn was recorded
 */
public record ConversationTurn(
    @NotNull String turnId,
    @NotNull String profileId,
    @NotNull String text,
    @NotNull ConversationType conversationType,
    @NotNull List<String> recentTurns,
    @NotNull Instant recordedAt
) {

    public ConversationTurn {
        ProfileIds.requireValid(profileId);
        Objects.requireNonNull(text, "text must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        turnId = turnId == null || turnId.isBlank() ? UuidUtils.newId() : turnId.trim();
        conversationType = conversationType != null ? conversationType : ConversationType.CHAT;
        recentTurns = recentTurns != null ? List.copyOf(recentTurns) : List.of();
        Objects.requireNonNull(recordedAt, "recordedAt must not be null");
    }

    @NotNull
    public static ConversationTurn of(@NotNull String profileId, @NotNull String text, @Nullable List<String> recentTurns) {
        return new ConversationTurn(null, profileId, text, ConversationType.CHAT, recentTurns, Instant.now());
    }

    /**
     * The last {@code maxTurns} prior utterances.
     */
    @NotNull
    public List<String> contextWindow(int maxTurns) {
        if (maxTurns <= 0) {
            return List.of();
        }
        int from = Math.max(0, recentTurns.size() - maxTurns);
        return recentTurns.subList(from, recentTurns.size());
    }
}
