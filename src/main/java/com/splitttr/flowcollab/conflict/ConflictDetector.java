package com.splitttr.flowcollab.conflict;

import com.splitttr.flowcollab.graph.EdgeState;
import com.splitttr.flowcollab.graph.WorkflowGraph;
import com.splitttr.flowcollab.model.Conflict;
import com.splitttr.flowcollab.model.ConflictType;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.OperationType;
import com.splitttr.flowcollab.model.payload.EdgeAddPayload;
import com.splitttr.flowcollab.model.payload.EdgeUpdatePayload;
import com.splitttr.flowcollab.model.payload.NodeUpdatePayload;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies how a submitted operation relates to each operation of its concurrent window.
 *
 * <p>Rules are checked in priority order and the first match wins for a pair: delete, dependency,
 * same-target update, position. Classification is symmetric, so a submitted delete is matched
 * against the updates it defeats just as a submitted update is matched against a committed delete.
 * Operations on disjoint targets never conflict.
 */
public class ConflictDetector {

    public List<Conflict> detect(Operation submitted, List<Operation> window, WorkflowGraph graph) {
        List<Conflict> conflicts = new ArrayList<>();
        for (Operation committed : window) {
            classify(committed, submitted, graph)
                .ifPresent(type -> conflicts.add(Conflict.between(committed, submitted, type)));
        }
        return conflicts;
    }

    Optional<ConflictType> classify(Operation committed, Operation submitted, WorkflowGraph graph) {
        if (isDeleteConflict(committed, submitted) || isDeleteConflict(submitted, committed)) {
            return Optional.of(ConflictType.DELETE);
        }
        if (isDependencyConflict(committed, submitted, graph) || isDependencyConflict(submitted, committed, graph)) {
            return Optional.of(ConflictType.DEPENDENCY);
        }
        if (committed.type().isUpdate() && submitted.type().isUpdate()
            && committed.target().equals(submitted.target())) {
            return Optional.of(ConflictType.SAME_TARGET_UPDATE);
        }
        if (isPositionConflict(committed, submitted)) {
            return Optional.of(ConflictType.POSITION);
        }
        return Optional.empty();
    }

    // delete removes the target that other updates, re-adds or deletes again
    private static boolean isDeleteConflict(Operation delete, Operation other) {
        if (!delete.type().isDelete() || !delete.target().equals(other.target())) {
            return false;
        }
        return other.type().isUpdate() || other.type().isAdd() || other.type().isDelete();
    }

    // nodeDelete removes a node that edgeOp uses as an endpoint
    private static boolean isDependencyConflict(Operation nodeDelete, Operation edgeOp, WorkflowGraph graph) {
        if (nodeDelete.type() != OperationType.NODE_DELETE || !edgeOp.type().touchesEdgeEndpoints()) {
            return false;
        }
        return endpoints(edgeOp, graph).contains(nodeDelete.target().id());
    }

    private static boolean isPositionConflict(Operation a, Operation b) {
        if (a.type() != OperationType.NODE_UPDATE || b.type() != OperationType.NODE_UPDATE) {
            return false;
        }
        var pa = (NodeUpdatePayload) a.ownPayload();
        var pb = (NodeUpdatePayload) b.ownPayload();
        return pa.bounds() != null && pb.bounds() != null && pa.bounds().overlaps(pb.bounds());
    }

    /**
     * Node ids an edge operation connects. For an update this is every endpoint the edge has
     * before or after it: the payload's, the edge's current ones (its last known ones once
     * removed), and, for an applied update, the ones it replaced.
     */
    public static Set<String> endpoints(Operation edgeOp, WorkflowGraph graph) {
        Set<String> ids = new HashSet<>();
        if (edgeOp.payload() instanceof EdgeAddPayload add) {
            addIfPresent(ids, add.source());
            addIfPresent(ids, add.target());
        } else if (edgeOp.ownPayload() instanceof EdgeUpdatePayload update) {
            addIfPresent(ids, update.source());
            addIfPresent(ids, update.target());
            addEndpoints(ids, graph.lastKnownEdge(edgeOp.target().id()));
            addEndpoints(ids, graph.edgeBefore(edgeOp.id()));
        }
        return ids;
    }

    private static void addEndpoints(Set<String> ids, EdgeState edge) {
        if (edge != null) {
            addIfPresent(ids, edge.source());
            addIfPresent(ids, edge.target());
        }
    }

    private static void addIfPresent(Set<String> ids, String id) {
        if (id != null) {
            ids.add(id);
        }
    }
}
