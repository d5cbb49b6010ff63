package br.edu.ifba.mindgraph.understanding;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractionPromptsTest {

    @Test
    void testSystemPromptListsTypes() {
        String prompt = ExtractionPrompts.systemPrompt(List.of("experienced", "causes"));

        assertTrue(prompt.contains("Person, Emotion, Activity, Place, Interest"));
        assertTrue(prompt.contains("experienced, causes"));
        assertTrue(prompt.contains("\"entities\""));
    }

    @Test
    void testUserPromptIncludesContext() {
        String prompt = ExtractionPrompts.userPrompt("Work was stressful", List.of("Hi", "How was your day?"));

        assertTrue(prompt.contains("- Hi\n- How was your day?"));
        assertTrue(prompt.contains("Current message:\nWork was stressful"));
    }

    @Test
    void testUserPromptWithoutContext() {
        assertTrue(ExtractionPrompts.userPrompt("hello", List.of()).contains("(none)"));
    }
}
