package com.splitttr.flowcollab.graph;

import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.payload.EdgeAddPayload;
import com.splitttr.flowcollab.model.payload.EdgeUpdatePayload;
import com.splitttr.flowcollab.model.payload.KeyPaths;
import com.splitttr.flowcollab.model.payload.NodeAddPayload;
import com.splitttr.flowcollab.model.payload.NodeUpdatePayload;
import com.splitttr.flowcollab.model.payload.PropertyUpdatePayload;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Materialised nodes, edges and workflow properties of one session. Not thread-safe: it is
 * mutated only by the owning session pipeline, in commit order.
 */
public class WorkflowGraph {

    private final Map<String, NodeState> nodes = new LinkedHashMap<>();
    private final Map<String, EdgeState> edges = new LinkedHashMap<>();
    private Map<String, Object> properties = new LinkedHashMap<>();
    private long version;

    // edge state just before each applied edge update, by operation id
    private final Map<String, EdgeState> edgesBeforeUpdate = new HashMap<>();
    // last state of each removed edge, by edge id
    private final Map<String, EdgeState> removedEdges = new HashMap<>();

    public WorkflowGraph(GraphSnapshot initial) {
        nodes.putAll(initial.nodes());
        edges.putAll(initial.edges());
        properties.putAll(initial.properties());
        version = initial.version();
    }

    /**
     * Rebuilds a graph by applying committed operations in order onto {@code initial}.
     */
    public static WorkflowGraph replay(GraphSnapshot initial, List<Operation> committed) {
        var graph = new WorkflowGraph(initial);
        committed.forEach(graph::apply);
        return graph;
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public boolean hasEdge(String id) {
        return edges.containsKey(id);
    }

    public NodeState node(String id) {
        return nodes.get(id);
    }

    public EdgeState edge(String id) {
        return edges.get(id);
    }

    /**
     * The edge as it was right before the edge update {@code operationId} was applied, or
     * {@code null} when that update found no edge or was never applied.
     */
    public EdgeState edgeBefore(String operationId) {
        return edgesBeforeUpdate.get(operationId);
    }

    /**
     * The current edge, or its last state if it has been removed.
     */
    public EdgeState lastKnownEdge(String id) {
        EdgeState current = edges.get(id);
        return current != null ? current : removedEdges.get(id);
    }

    public long version() {
        return version;
    }

    /**
     * Applies a committed operation. Rejected operations only advance the version.
     */
    public void apply(Operation op) {
        if (op.committedVersion() != null) {
            version = Math.max(version, op.committedVersion());
        }
        if (!op.status().isEffective()) {
            return;
        }
        String id = op.target().id();
        switch (op.type()) {
            case NODE_ADD -> {
                var p = (NodeAddPayload) op.payload();
                nodes.put(id, new NodeState(id, p.nodeType(), p.label(), p.bounds(), KeyPaths.deepMerge(null, p.data())));
            }
            case NODE_UPDATE -> {
                var p = (NodeUpdatePayload) op.ownPayload();
                nodes.computeIfPresent(id, (k, n) -> new NodeState(k, n.nodeType(),
                    p.label() != null ? p.label() : n.label(),
                    p.bounds() != null ? p.bounds() : n.bounds(),
                    KeyPaths.deepMerge(n.data(), p.data())));
            }
            case NODE_DELETE -> {
                nodes.remove(id);
                for (EdgeState cascaded : edges.values().stream().filter(e -> e.touches(id)).toList()) {
                    edges.remove(cascaded.id());
                    removedEdges.put(cascaded.id(), cascaded);
                }
            }
            case EDGE_ADD -> {
                var p = (EdgeAddPayload) op.payload();
                edges.put(id, new EdgeState(id, p.source(), p.target(), p.label(), KeyPaths.deepMerge(null, p.data())));
            }
            case EDGE_UPDATE -> {
                var p = (EdgeUpdatePayload) op.ownPayload();
                EdgeState before = edges.get(id);
                if (before != null) {
                    edgesBeforeUpdate.put(op.id(), before);
                }
                edges.computeIfPresent(id, (k, e) -> new EdgeState(k,
                    p.source() != null ? p.source() : e.source(),
                    p.target() != null ? p.target() : e.target(),
                    p.label() != null ? p.label() : e.label(),
                    KeyPaths.deepMerge(e.data(), p.data())));
            }
            case EDGE_DELETE -> {
                EdgeState removed = edges.remove(id);
                if (removed != null) {
                    removedEdges.put(id, removed);
                }
            }
            case PROPERTY_UPDATE -> applyProperties(op, (PropertyUpdatePayload) op.ownPayload());
        }
    }

    private void applyProperties(Operation op, PropertyUpdatePayload p) {
        String id = op.target().id();
        switch (op.target().kind()) {
            case NODE -> nodes.computeIfPresent(id, (k, n) ->
                new NodeState(k, n.nodeType(), n.label(), n.bounds(), KeyPaths.deepMerge(n.data(), p.properties())));
            case EDGE -> edges.computeIfPresent(id, (k, e) ->
                new EdgeState(k, e.source(), e.target(), e.label(), KeyPaths.deepMerge(e.data(), p.properties())));
            case WORKFLOW -> properties = KeyPaths.deepMerge(properties, p.properties());
        }
    }

    public GraphSnapshot snapshot() {
        return new GraphSnapshot(
            Collections.unmodifiableMap(new LinkedHashMap<>(nodes)),
            Collections.unmodifiableMap(new LinkedHashMap<>(edges)),
            Collections.unmodifiableMap(new LinkedHashMap<>(properties)),
            version
        );
    }
}
