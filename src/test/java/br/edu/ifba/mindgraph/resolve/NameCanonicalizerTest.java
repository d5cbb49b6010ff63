package br.edu.ifba.mindgraph.resolve;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link NameCanonicalizer}.
 */
class NameCanonicalizerTest {

    private NameCanonicalizer canonicalizer;

    @BeforeEach
    void setUp() {
        canonicalizer = new NameCanonicalizer(Map.of("Mom", "Mother", "bf", "boyfriend"));
    }

    @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
    @CsvSource({
        "Sarah, sarah",
        "'  SARAH  ', sarah",
        "Sarah's, sarah",
        "the Gym, gym",
        "'my best   friend', best friend",
        "'\"Yoga!\"', yoga",
        "Café, café"
    })
    @DisplayName("Surface forms collapse to one canonical key")
    void testCanonicalize(String raw, String expected) {
        assertEquals(expected, canonicalizer.canonicalize(raw));
    }

    @Test
    @DisplayName("Aliases are applied after normalization")
    void testAliases() {
        assertEquals("mother", canonicalizer.canonicalize("my Mom"));
        assertEquals("mother", canonicalizer.canonicalize("MOM"));
        assertEquals("boyfriend", canonicalizer.canonicalize("bf"));
    }

    @Test
    @DisplayName("normalize ignores aliases")
    void testNormalizeIgnoresAliases() {
        assertEquals("mom", NameCanonicalizer.normalize("Mom"));
    }

    @Test
    @DisplayName("Names without content become empty")
    void testEmptyResults() {
        assertEquals("", canonicalizer.canonicalize(null));
        assertEquals("", canonicalizer.canonicalize("   "));
        assertEquals("", canonicalizer.canonicalize("..."));
    }

    @Test
    @DisplayName("A lone determiner is kept as the name")
    void testLoneDeterminer() {
        assertEquals("my", canonicalizer.canonicalize("my"));
    }
}
