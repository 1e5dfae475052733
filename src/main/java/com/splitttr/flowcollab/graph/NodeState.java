package com.splitttr.flowcollab.graph;

import com.splitttr.flowcollab.model.Bounds;

import java.util.Map;

public record NodeState(
    String id,
    String nodeType,
    String label,
    Bounds bounds,
    Map<String, Object> data
) {}
