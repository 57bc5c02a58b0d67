package com.journal.archive.rules;

import com.journal.archive.core.model.EntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should fold case and strip diacritics")
    void testCaseAndDiacritics() {
        assertEquals("jose", engine.normalize("José", EntityKind.PERSON));
        assertEquals("montreal", engine.normalize("MONTRÉAL", EntityKind.CITY));
    }

    @Test
    @DisplayName("Should read hyphens as spaces and drop apostrophes")
    void testPunctuation() {
        assertEquals("jose maria obrien", engine.normalize("José-María O'Brien", EntityKind.PERSON));
        assertEquals("jose maria obrien", engine.normalize("jose maria o’brien", EntityKind.PERSON));
    }

    @Test
    @DisplayName("Should collapse and trim whitespace")
    void testWhitespace() {
        assertEquals("cafe olimpico", engine.normalize("  Café   Olimpico ", EntityKind.LOCATION));
    }

    @Test
    @DisplayName("Should give narrated dates a spacing-insensitive key")
    void testDates() {
        String key = engine.normalize("~2021-11", EntityKind.NARRATED_DATE);
        assertEquals("~202111", key);
        assertEquals(key, engine.normalize("~ 2021 - 11", EntityKind.NARRATED_DATE));
    }

    @Test
    @DisplayName("Should not apply date rules to other kinds")
    void testDateRuleScoped() {
        assertEquals("2021 11", engine.normalize("2021-11", EntityKind.TAG));
    }

    @Test
    @DisplayName("Should return empty key for blank input")
    void testBlank() {
        assertEquals("", engine.normalize(null, EntityKind.PERSON));
        assertEquals("", engine.normalize("   ", EntityKind.PERSON));
    }

    @Test
    @DisplayName("Should compare names by key")
    void testEquivalence() {
        assertTrue(engine.areEquivalent("Clara", "clára", EntityKind.PERSON));
        assertFalse(engine.areEquivalent("Clara", "Claire", EntityKind.PERSON));
    }

    @Test
    @DisplayName("Should run custom rules in priority order")
    void testCustomRules() {
        NormalizationEngine custom = new NormalizationEngine(List.of(
                NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()));
        assertEquals("c", custom.normalize("a"));
        assertEquals("first", custom.getRules().get(0).getName());
    }

    @Test
    @DisplayName("Should ignore kind-specific rules when no kind is given")
    void testNullKind() {
        assertEquals("2021 11", engine.normalize("2021-11"));
    }
}
