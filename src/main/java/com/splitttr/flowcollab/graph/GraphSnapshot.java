package com.splitttr.flowcollab.graph;

import java.util.Map;

/**
 * Immutable copy of a workflow graph at {@code version}.
 */
public record GraphSnapshot(
    Map<String, NodeState> nodes,
    Map<String, EdgeState> edges,
    Map<String, Object> properties,
    long version
) {
    public static GraphSnapshot empty() {
        return new GraphSnapshot(Map.of(), Map.of(), Map.of(), 0);
    }

    /**
     * Same content, ignoring the version it was taken at.
     */
    public boolean sameContentAs(GraphSnapshot other) {
        return nodes.equals(other.nodes) && edges.equals(other.edges) && properties.equals(other.properties);
    }
}
