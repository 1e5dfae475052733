package com.splitttr.flowcollab.model.payload;

import java.util.LinkedHashMap;
import java.util.Map;

public record EdgeUpdatePayload(
    String source,
    String target,
    String label,
    Map<String, Object> data
) implements FieldUpdate {

    @Override
    public Map<String, Object> fieldChanges() {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (source != null) changes.put("source", source);
        if (target != null) changes.put("target", target);
        if (label != null) changes.put("label", label);
        changes.putAll(KeyPaths.flatten(KeyPaths.DATA, data));
        return changes;
    }

    @Override
    public EdgeUpdatePayload withFieldChanges(Map<String, Object> changes) {
        return new EdgeUpdatePayload(
            (String) changes.get("source"),
            (String) changes.get("target"),
            (String) changes.get("label"),
            KeyPaths.unflatten(KeyPaths.DATA, changes)
        );
    }
}
