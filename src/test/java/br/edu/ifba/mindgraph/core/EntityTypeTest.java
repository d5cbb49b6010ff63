package br.edu.ifba.mindgraph.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityTypeTest {

    @ParameterizedTest
    @CsvSource({
        "Person, PERSON",
        "PERSON, PERSON",
        "emotion, EMOTION",
        "feeling, EMOTION",
        "hobby, INTEREST",
        "location, PLACE",
        "' Activity ', ACTIVITY"
    })
    void testFromLabelAcceptsNamesAndSynonyms(String label, EntityType expected) {
        assertEquals(Optional.of(expected), EntityType.fromLabel(label));
    }

    @Test
    void testFromLabelRejectsUnknown() {
        assertTrue(EntityType.fromLabel("Organization").isEmpty());
        assertTrue(EntityType.fromLabel("  ").isEmpty());
        assertTrue(EntityType.fromLabel(null).isEmpty());
    }

    @Test
    void testLabel() {
        assertEquals("Place", EntityType.PLACE.label());
    }
}
