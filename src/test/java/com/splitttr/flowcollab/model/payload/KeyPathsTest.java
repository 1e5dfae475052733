package com.splitttr.flowcollab.model.payload;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class KeyPathsTest {

    @Test
    void flattensNestedMapsIntoLeafPaths() {
        Map<String, Object> flat = KeyPaths.flatten("data", Map.of(
            "color", "red",
            "retry", Map.of("count", 3, "backoff", Map.of("ms", 200))
        ));

        Assertions.assertEquals(Map.of(
            "data.color", "red",
            "data.retry.count", 3,
            "data.retry.backoff.ms", 200
        ), flat);
    }

    @Test
    void unflattenKeepsOnlyEntriesUnderThePrefix() {
        Map<String, Object> flat = new HashMap<>();
        flat.put("label", "Start");
        flat.put("data.retry.count", 3);
        flat.put("data.color", "red");

        Assertions.assertEquals(Map.of("retry", Map.of("count", 3), "color", "red"),
            KeyPaths.unflatten("data", flat));
        Assertions.assertNull(KeyPaths.unflatten("data", Map.of("label", "Start")));
    }

    @Test
    void pathsOverlapOnlyOnDottedAncestry() {
        Assertions.assertTrue(KeyPaths.overlaps("data.retry", "data.retry.count"));
        Assertions.assertTrue(KeyPaths.overlaps("bounds", "bounds"));
        Assertions.assertFalse(KeyPaths.overlaps("data.color", "data.colors"));
        Assertions.assertFalse(KeyPaths.overlaps("data.color", "data.label"));
        Assertions.assertTrue(KeyPaths.overlapsAny("data.retry.count", List.of("label", "data.retry")));
    }

    @Test
    void deepMergeRemovesNullLeaves() {
        Map<String, Object> base = Map.of("color", "red", "retry", Map.of("count", 3, "ms", 100));
        Map<String, Object> changes = new HashMap<>();
        changes.put("color", null);
        changes.put("retry", Map.of("count", 5));

        Map<String, Object> merged = KeyPaths.deepMerge(base, changes);

        Assertions.assertEquals(Map.of("retry", Map.of("count", 5, "ms", 100)), merged);
        Assertions.assertEquals("red", base.get("color"));
    }

    @Test
    void nonStringKeysBecomePathSegments() {
        Map<Object, Object> retry = new HashMap<>();
        retry.put(1, "fast");
        retry.put(true, "on");

        Map<String, Object> flat = KeyPaths.flatten("data", Map.of("retry", retry));

        Assertions.assertEquals(Map.of("data.retry.1", "fast", "data.retry.true", "on"), flat);
    }

    @Test
    void deepMergeCopiesNestedMapsWithStringKeys() {
        Map<Object, Object> existing = new HashMap<>();
        existing.put(7, "seven");
        Map<String, Object> base = Map.of("retry", existing);

        Map<String, Object> merged = KeyPaths.deepMerge(base, Map.of("retry", Map.of("count", 5)));

        Assertions.assertEquals(Map.of("retry", Map.of("7", "seven", "count", 5)), merged);
        Assertions.assertEquals(Map.of(7, "seven"), existing);
    }

    @Test
    void unflattenMergesSiblingPathsIntoOneNestedMap() {
        Map<String, Object> flat = new HashMap<>();
        flat.put("data.retry.count", 3);
        flat.put("data.retry.ms", 100);

        Assertions.assertEquals(Map.of("retry", Map.of("count", 3, "ms", 100)), KeyPaths.unflatten("data", flat));
    }
}
