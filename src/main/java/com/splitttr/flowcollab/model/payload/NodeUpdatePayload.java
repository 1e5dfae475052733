package com.splitttr.flowcollab.model.payload;

import com.splitttr.flowcollab.model.Bounds;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Partial node update. {@code null} components are left untouched; a non-null {@code bounds}
 * marks the update as spatial.
 */
public record NodeUpdatePayload(
    String label,
    Bounds bounds,
    Map<String, Object> data
) implements FieldUpdate {

    @Override
    public Map<String, Object> fieldChanges() {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (label != null) changes.put("label", label);
        if (bounds != null) changes.put("bounds", bounds);
        changes.putAll(KeyPaths.flatten(KeyPaths.DATA, data));
        return changes;
    }

    @Override
    public NodeUpdatePayload withFieldChanges(Map<String, Object> changes) {
        return new NodeUpdatePayload(
            (String) changes.get("label"),
            (Bounds) changes.get("bounds"),
            KeyPaths.unflatten(KeyPaths.DATA, changes)
        );
    }

    public NodeUpdatePayload withBounds(Bounds newBounds) {
        return new NodeUpdatePayload(label, newBounds, data);
    }
}
