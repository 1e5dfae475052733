package com.splitttr.flowcollab.model.payload;

import java.util.Map;

/**
 * Sets properties on a node, an edge or the workflow itself. Paths are rooted at {@code data}
 * so that they line up with the data fields of a node or edge update on the same target.
 */
public record PropertyUpdatePayload(Map<String, Object> properties) implements FieldUpdate {

    public PropertyUpdatePayload {
        properties = properties == null ? Map.of() : properties;
    }

    @Override
    public Map<String, Object> fieldChanges() {
        return KeyPaths.flatten(KeyPaths.DATA, properties);
    }

    @Override
    public PropertyUpdatePayload withFieldChanges(Map<String, Object> changes) {
        Map<String, Object> rebuilt = KeyPaths.unflatten(KeyPaths.DATA, changes);
        return new PropertyUpdatePayload(rebuilt == null ? Map.of() : rebuilt);
    }
}
