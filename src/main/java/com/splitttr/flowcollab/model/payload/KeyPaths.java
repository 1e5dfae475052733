package com.splitttr.flowcollab.model.payload;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dotted key path helpers for nested JSON-like maps.
 */
public final class KeyPaths {

    public static final String DATA = "data";

    private KeyPaths() {
    }

    /**
     * Flattens {@code map} into leaf paths under {@code prefix}. Empty nested maps are kept as leaves.
     */
    public static Map<String, Object> flatten(String prefix, Map<String, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (map != null) {
            collect(prefix, map, out);
        }
        return out;
    }

    private static void collect(String prefix, Map<?, ?> map, Map<String, Object> out) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String path = prefix == null || prefix.isEmpty() ? key : prefix + "." + key;
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
                collect(path, nested, out);
            } else {
                out.put(path, value);
            }
        }
    }

    /**
     * Rebuilds a nested map from the entries of {@code flat} that live under {@code prefix}.
     * Returns {@code null} when no entry does.
     */
    public static Map<String, Object> unflatten(String prefix, Map<String, Object> flat) {
        String lead = prefix + ".";
        Map<String, Object> root = null;
        for (var entry : flat.entrySet()) {
            if (!entry.getKey().startsWith(lead)) {
                continue;
            }
            if (root == null) {
                root = new LinkedHashMap<>();
            }
            put(root, entry.getKey().substring(lead.length()), entry.getValue());
        }
        return root;
    }

    private static void put(Map<String, Object> root, String path, Object value) {
        String[] keys = path.split("\\.");
        Map<String, Object> current = root;
        for (int i = 0; i < keys.length - 1; i++) {
            Map<String, Object> next = current.get(keys[i]) instanceof Map<?, ?> existing
                ? copyOf(existing)
                : new LinkedHashMap<>();
            current.put(keys[i], next);
            current = next;
        }
        current.put(keys[keys.length - 1], value);
    }

    /**
     * Two paths overlap when they are equal or one is a dotted ancestor of the other.
     */
    public static boolean overlaps(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        return a.startsWith(b + ".") || b.startsWith(a + ".");
    }

    public static boolean overlapsAny(String path, Collection<String> others) {
        for (String other : others) {
            if (overlaps(path, other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Deep-merges {@code changes} into a copy of {@code base}. A {@code null} leaf removes the key.
     */
    public static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, ?> changes) {
        Map<String, Object> merged = base == null ? new LinkedHashMap<>() : new LinkedHashMap<>(base);
        if (changes == null) {
            return merged;
        }
        for (var entry : changes.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                merged.remove(entry.getKey());
            } else if (value instanceof Map<?, ?> nested && merged.get(entry.getKey()) instanceof Map<?, ?> existing) {
                merged.put(entry.getKey(), deepMerge(copyOf(existing), copyOf(nested)));
            } else {
                merged.put(entry.getKey(), value);
            }
        }
        return merged;
    }

    /**
     * String-keyed copy of a nested map read from JSON-like data.
     */
    private static Map<String, Object> copyOf(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }
}
