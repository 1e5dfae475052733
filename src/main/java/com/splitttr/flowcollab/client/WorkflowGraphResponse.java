package com.splitttr.flowcollab.client;

import com.splitttr.flowcollab.graph.EdgeState;
import com.splitttr.flowcollab.graph.NodeState;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record WorkflowGraphResponse(
    String workflowId,
    List<NodeState> nodes,
    List<EdgeState> edges,
    Map<String, Object> properties,
    Instant updatedAt,
    long version
) {}
