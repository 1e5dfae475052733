package com.splitttr.flowcollab.graph;

import java.util.Map;

public record EdgeState(
    String id,
    String source,
    String target,
    String label,
    Map<String, Object> data
) {
    public boolean touches(String nodeId) {
        return nodeId.equals(source) || nodeId.equals(target);
    }
}
