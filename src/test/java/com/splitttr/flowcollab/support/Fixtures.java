package com.splitttr.flowcollab.support;

import com.splitttr.flowcollab.config.CollabConfig;
import com.splitttr.flowcollab.graph.EdgeState;
import com.splitttr.flowcollab.graph.GraphSnapshot;
import com.splitttr.flowcollab.graph.NodeState;
import com.splitttr.flowcollab.model.Bounds;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.OperationStatus;
import com.splitttr.flowcollab.model.OperationType;
import com.splitttr.flowcollab.model.Role;
import com.splitttr.flowcollab.model.SessionSettings;
import com.splitttr.flowcollab.model.Target;
import com.splitttr.flowcollab.model.payload.EdgeAddPayload;
import com.splitttr.flowcollab.model.payload.EdgeDeletePayload;
import com.splitttr.flowcollab.model.payload.EdgeUpdatePayload;
import com.splitttr.flowcollab.model.payload.NodeAddPayload;
import com.splitttr.flowcollab.model.payload.NodeDeletePayload;
import com.splitttr.flowcollab.model.payload.NodeUpdatePayload;
import com.splitttr.flowcollab.model.payload.OperationPayload;
import com.splitttr.flowcollab.model.payload.PropertyUpdatePayload;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operations and graphs shared by the tests. Every operation is built with a fixed timestamp so
 * precedence never depends on the wall clock.
 */
public final class Fixtures {

    public static final String WORKFLOW = "wf-1";
    public static final String SESSION = "session-1";
    public static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");

    private Fixtures() {
    }

    public static CollabConfig config() {
        return config(256, true);
    }

    public static CollabConfig config(int queueDepth, boolean autoSave) {
        return new CollabConfig(queueDepth, 500, 24, Duration.ofMinutes(5), settings(10, autoSave));
    }

    public static SessionSettings settings(int maxParticipants, boolean autoSave) {
        return new SessionSettings(EnumSet.allOf(Role.class), maxParticipants, autoSave);
    }

    public static Instant at(int second) {
        return T0.plusSeconds(second);
    }

    /**
     * A graph whose nodes sit 1000px apart on one row, so they never overlap.
     */
    public static GraphSnapshot graph(String... nodeIds) {
        Map<String, NodeState> nodes = new LinkedHashMap<>();
        for (int i = 0; i < nodeIds.length; i++) {
            nodes.put(nodeIds[i], new NodeState(nodeIds[i], "task", nodeIds[i].toUpperCase(),
                new Bounds(i * 1000, 0, 100, 50), Map.of()));
        }
        return new GraphSnapshot(nodes, Map.of(), Map.of(), 0);
    }

    public static GraphSnapshot withEdge(GraphSnapshot graph, String edgeId, String source, String target) {
        Map<String, EdgeState> edges = new LinkedHashMap<>(graph.edges());
        edges.put(edgeId, new EdgeState(edgeId, source, target, null, Map.of()));
        return new GraphSnapshot(graph.nodes(), edges, graph.properties(), graph.version());
    }

    public static Operation op(String id, String author, int second, OperationType type, Target target,
                               OperationPayload payload, long baseVersion) {
        return new Operation(id, SESSION, WORKFLOW, author, type, target, payload, baseVersion, null,
            OperationStatus.PENDING, at(second), null, null);
    }

    public static Operation nodeAdd(String id, String author, int second, String nodeId, Bounds bounds) {
        return op(id, author, second, OperationType.NODE_ADD, Target.node(nodeId),
            new NodeAddPayload("task", nodeId, bounds, Map.of()), 0);
    }

    public static Operation move(String id, String author, int second, String nodeId, Bounds bounds) {
        return op(id, author, second, OperationType.NODE_UPDATE, Target.node(nodeId),
            new NodeUpdatePayload(null, bounds, null), 0);
    }

    public static Operation nodeDelete(String id, String author, int second, String nodeId) {
        return op(id, author, second, OperationType.NODE_DELETE, Target.node(nodeId), new NodeDeletePayload(), 0);
    }

    public static Operation edgeAdd(String id, String author, int second, String edgeId, String source, String target) {
        return op(id, author, second, OperationType.EDGE_ADD, Target.edge(edgeId),
            new EdgeAddPayload(source, target, null, null), 0);
    }

    public static Operation retarget(String id, String author, int second, String edgeId, String source, String target) {
        return op(id, author, second, OperationType.EDGE_UPDATE, Target.edge(edgeId),
            new EdgeUpdatePayload(source, target, null, null), 0);
    }

    public static Operation edgeDelete(String id, String author, int second, String edgeId) {
        return op(id, author, second, OperationType.EDGE_DELETE, Target.edge(edgeId), new EdgeDeletePayload(), 0);
    }

    public static Operation properties(String id, String author, int second, Target target, Map<String, Object> values) {
        return op(id, author, second, OperationType.PROPERTY_UPDATE, target, new PropertyUpdatePayload(values), 0);
    }

    public static Operation rebased(Operation op, long baseVersion) {
        return new Operation(op.id(), op.sessionId(), op.workflowId(), op.authorId(), op.type(), op.target(),
            op.payload(), baseVersion, op.committedVersion(), op.status(), op.timestamp(), op.rejection(),
            op.supersededBy());
    }
}
