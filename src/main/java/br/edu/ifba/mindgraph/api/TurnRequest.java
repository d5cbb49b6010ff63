package br.edu.ifba.mindgraph.api;

import br.edu.ifba.mindgraph.extraction.ConversationType;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record TurnRequest(
    @JsonProperty("turn_id")
    @Size(max = 128, message = "turn_id must be at most 128 characters")
    String turnId,

    @NotBlank(message = "text must not be blank")
    @Size(max = 20000, message = "text must be at most 20000 characters")
    String text,

    @JsonProperty("conversation_type")
    ConversationType conversationType,

    @JsonProperty("recent_turns")
    @Size(max = 50, message = "recent_turns must hold at most 50 entries")
    List<String> recentTurns
) {
}
