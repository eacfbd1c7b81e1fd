package com.awsmap.inventory.filter;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TagFilterEngineTest {

    private final TagFilterEngine engine = new TagFilterEngine();

    @Test
    void testValuesOfOneKeyAreAlternatives() {
        TagFilter filter = TagFilter.parse(List.of("Env=prod", "Env=staging"));

        assertTrue(engine.matches(Map.of("Env", "prod"), filter));
        assertTrue(engine.matches(Map.of("Env", "staging"), filter));
        assertFalse(engine.matches(Map.of("Env", "dev"), filter));
    }

    @Test
    void testEveryKeyMustMatch() {
        TagFilter filter = TagFilter.parse(List.of("Env=prod", "Team=core"));

        assertTrue(engine.matches(Map.of("Env", "prod", "Team", "core", "Extra", "x"), filter));
        assertFalse(engine.matches(Map.of("Env", "prod"), filter));
        assertFalse(engine.matches(Map.of("Env", "prod", "Team", "edge"), filter));
    }

    @Test
    void testEmptyFilterMatchesEverything() {
        assertTrue(engine.matches(Map.of(), TagFilter.empty()));
        assertTrue(engine.matches(Map.of("Env", "prod"), null));
    }

    @Test
    void testUntaggedResourceFailsNonEmptyFilter() {
        assertFalse(engine.matches(null, TagFilter.parse(List.of("Env=prod"))));
        assertFalse(engine.matches(Map.of(), TagFilter.parse(List.of("Env=prod"))));
    }

    @Test
    void testMatchingIsCaseSensitive() {
        assertFalse(engine.matches(Map.of("env", "prod"), TagFilter.parse(List.of("Env=prod"))));
        assertFalse(engine.matches(Map.of("Env", "Prod"), TagFilter.parse(List.of("Env=prod"))));
    }
}
