package com.splitttr.flowcollab.transform;

import com.splitttr.flowcollab.conflict.ConflictDetector;
import com.splitttr.flowcollab.error.InvalidOperationException;
import com.splitttr.flowcollab.error.StaleBaseVersionException;
import com.splitttr.flowcollab.graph.EdgeState;
import com.splitttr.flowcollab.graph.NodeState;
import com.splitttr.flowcollab.graph.WorkflowGraph;
import com.splitttr.flowcollab.log.CommitHistory;
import com.splitttr.flowcollab.model.Bounds;
import com.splitttr.flowcollab.model.Conflict;
import com.splitttr.flowcollab.model.ConflictType;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.OperationStatus;
import com.splitttr.flowcollab.model.OperationType;
import com.splitttr.flowcollab.model.RejectionReason;
import com.splitttr.flowcollab.model.TargetKind;
import com.splitttr.flowcollab.model.payload.EdgeAddPayload;
import com.splitttr.flowcollab.model.payload.EdgeDeletePayload;
import com.splitttr.flowcollab.model.payload.EdgeUpdatePayload;
import com.splitttr.flowcollab.model.payload.FieldUpdate;
import com.splitttr.flowcollab.model.payload.KeyPaths;
import com.splitttr.flowcollab.model.payload.NodeUpdatePayload;
import com.splitttr.flowcollab.model.payload.OperationPayload;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves a submission against the conflicts found in its concurrent window.
 *
 * <p>Every rule is decided by operation content and the {@link Operation#PRECEDENCE} order only,
 * never by arrival order, so any permutation of the same concurrent submissions converges:
 * <ul>
 *   <li>delete: the delete wins, the update or add is rejected with {@code target-deleted};</li>
 *   <li>dependency: the edge operation is rejected with {@code dangling-reference}; an edge
 *       update it defeats after the fact is undone by a restore follow-up;</li>
 *   <li>concurrent adds of one id: the higher precedence add wins, the other is rejected with
 *       {@code already-exists};</li>
 *   <li>same-target update: the payload is folded with every concurrent change of the target;
 *       on overlapping paths the higher precedence wins and the loser becomes {@code transformed}
 *       with a pointer to the winner;</li>
 *   <li>position: the lower-precedence node is nudged clear of the other one.</li>
 * </ul>
 */
public class TransformEngine {

    static final String NUDGE = "~nudge~";
    static final String RESTORE = "~restore";

    private final double positionGap;

    public TransformEngine(double positionGap) {
        this.positionGap = positionGap;
    }

    /**
     * Explicit optimistic-concurrency check on the submission's base version.
     */
    public void checkBaseVersion(Operation op, long headVersion, long retainedWindow) {
        if (op.baseVersion() < 0 || op.baseVersion() > headVersion) {
            throw new InvalidOperationException(
                "Base version " + op.baseVersion() + " is not in [0, " + headVersion + "]");
        }
        if (headVersion - op.baseVersion() > retainedWindow) {
            throw new StaleBaseVersionException(op.baseVersion(), headVersion, retainedWindow);
        }
    }

    /**
     * @param history the session's committed log, for lookups by id and replays
     */
    public Resolution resolve(Operation submitted, List<Conflict> conflicts, List<Operation> window,
                              WorkflowGraph graph, CommitHistory history) {
        Map<String, Operation> windowById = window.stream()
            .collect(Collectors.toMap(Operation::id, Function.identity(), (a, b) -> b, LinkedHashMap::new));
        Map<String, Conflict> resolved = new LinkedHashMap<>();
        conflicts.forEach(c -> resolved.put(c.id(), c));

        // Committed deletes and their dependants defeat the submission outright.
        for (Conflict c : conflicts) {
            Operation committed = windowById.get(c.windowOperationId());
            if (c.type() == ConflictType.DELETE && committed.type().isDelete()) {
                resolved.put(c.id(), c.resolvedAs("delete-wins"));
                return Resolution.rejected(submitted, RejectionReason.TARGET_DELETED, committed.id(),
                    describe(submitted) + " was deleted by " + committed.id(), List.copyOf(resolved.values()));
            }
        }
        for (Conflict c : conflicts) {
            Operation committed = windowById.get(c.windowOperationId());
            if (c.type() == ConflictType.DEPENDENCY && committed.type() == OperationType.NODE_DELETE) {
                resolved.put(c.id(), c.resolvedAs("dangling-reference"));
                return Resolution.rejected(submitted, RejectionReason.DANGLING_REFERENCE, committed.id(),
                    "Endpoint node " + committed.target().id() + " was deleted by " + committed.id(),
                    List.copyOf(resolved.values()));
            }
        }

        Optional<Operation> rivalAdd = submitted.type().isAdd() ? concurrentAdd(submitted, window) : Optional.empty();
        Optional<Resolution> invalid = validateAgainst(graph, submitted, rivalAdd.isPresent(),
            List.copyOf(resolved.values()));
        if (invalid.isPresent()) {
            return invalid.get();
        }

        Map<String, Transition> transitions = new LinkedHashMap<>();
        List<Operation> followUps = new ArrayList<>();
        Operation current = submitted.applied();

        if (rivalAdd.isPresent()) {
            Operation rival = rivalAdd.get();
            if (submitted.precedes(rival)) {
                return Resolution.rejected(submitted, RejectionReason.ALREADY_EXISTS, rival.id(),
                    describe(submitted) + " was added concurrently by " + rival.id(), List.copyOf(resolved.values()));
            }
            // the later add replaces the target
            transitions.put(rival.id(), Transition.rejected(rival.id(), RejectionReason.ALREADY_EXISTS));
        }

        if (submitted.type().isDelete()) {
            collectDeleteTransitions(submitted, conflicts, window, windowById, graph, history, resolved,
                transitions, followUps);
        }
        if (submitted.payload() instanceof FieldUpdate) {
            current = resolveSameTarget(current, conflicts, windowById, resolved, transitions);
        }
        if (current.type() == OperationType.NODE_UPDATE) {
            current = resolvePosition(current, conflicts, windowById, graph, resolved, followUps);
        }

        return new Resolution(current, null, null, List.copyOf(resolved.values()),
            List.copyOf(transitions.values()), List.copyOf(followUps));
    }

    private void collectDeleteTransitions(Operation delete, List<Conflict> conflicts, List<Operation> window,
                                          Map<String, Operation> windowById, WorkflowGraph graph,
                                          CommitHistory history, Map<String, Conflict> resolved,
                                          Map<String, Transition> transitions, List<Operation> followUps) {
        Map<String, Operation> retargeted = new LinkedHashMap<>();
        for (Conflict c : conflicts) {
            Operation committed = windowById.get(c.windowOperationId());
            if (c.type() == ConflictType.DELETE && committed.type().isUpdate()) {
                transitions.put(committed.id(), Transition.rejected(committed.id(), RejectionReason.TARGET_DELETED));
                resolved.put(c.id(), c.resolvedAs("delete-wins"));
                retractNudges(delete, committed, window, graph, history, transitions, followUps);
            } else if (c.type() == ConflictType.DEPENDENCY && committed.type() == OperationType.EDGE_ADD) {
                // the cascade removes the edge; replaying without it yields the same graph
                transitions.put(committed.id(), Transition.rejected(committed.id(), RejectionReason.DANGLING_REFERENCE));
                resolved.put(c.id(), c.resolvedAs("dangling-reference"));
            } else if (c.type() == ConflictType.DEPENDENCY && committed.type() == OperationType.EDGE_UPDATE
                && movesEndpoint(committed, delete.target().id(), graph)) {
                transitions.put(committed.id(), Transition.rejected(committed.id(), RejectionReason.DANGLING_REFERENCE));
                resolved.put(c.id(), c.resolvedAs("dangling-reference"));
                retargeted.put(committed.target().id(), committed);
            } else if (c.type() == ConflictType.DELETE || c.type() == ConflictType.DEPENDENCY) {
                resolved.put(c.id(), c.resolvedAs("delete-wins"));
            }
        }
        if (!retargeted.isEmpty()) {
            WorkflowGraph without = history.replayWithout(transitions.keySet());
            retargeted.forEach((edgeId, update) ->
                restoreEdge(delete, update, graph.edge(edgeId), without.edge(edgeId), graph.version() + 1)
                    .ifPresent(followUps::add));
        }
    }

    /**
     * Whether an edge update sets, or moves the edge away from, {@code nodeId} as an endpoint.
     */
    private static boolean movesEndpoint(Operation update, String nodeId, WorkflowGraph graph) {
        var p = (EdgeUpdatePayload) update.ownPayload();
        if (nodeId.equals(p.source()) || nodeId.equals(p.target())) {
            return true;
        }
        EdgeState before = graph.edgeBefore(update.id());
        return before != null
            && (p.source() != null && nodeId.equals(before.source())
                || p.target() != null && nodeId.equals(before.target()));
    }

    /**
     * Puts an edge whose endpoint change was defeated by a node delete back to the state the
     * log yields without that change. {@code live} is the edge before the delete cascades.
     */
    private static Optional<Operation> restoreEdge(Operation delete, Operation update, EdgeState live,
                                                   EdgeState restored, long headVersion) {
        String nodeId = delete.target().id();
        String id = update.id() + RESTORE;
        if (restored != null && !restored.touches(nodeId)) {
            if (restored.equals(live)) {
                return Optional.empty();
            }
            var payload = new EdgeAddPayload(restored.source(), restored.target(), restored.label(), restored.data());
            return Optional.of(derived(id, update, OperationType.EDGE_ADD, payload, headVersion));
        }
        if (live != null && !live.touches(nodeId)) {
            return Optional.of(derived(id, update, OperationType.EDGE_DELETE, new EdgeDeletePayload(), headVersion));
        }
        return Optional.empty();
    }

    /**
     * A move that loses to a delete no longer pushes other nodes aside: the nudges it caused are
     * rejected with it, and a node still sitting where a nudge put it goes back to where its own
     * move placed it.
     */
    private static void retractNudges(Operation delete, Operation defeated, List<Operation> window, WorkflowGraph graph,
                                      CommitHistory history, Map<String, Transition> transitions,
                                      List<Operation> followUps) {
        String suffix = NUDGE + defeated.id();
        for (Operation nudge : window) {
            if (!nudge.id().endsWith(suffix) || nudge.target().equals(delete.target())) {
                continue;
            }
            transitions.put(nudge.id(), Transition.rejected(nudge.id(), RejectionReason.TARGET_DELETED));
            Bounds nudged = ((NodeUpdatePayload) nudge.payload()).bounds();
            NodeState node = graph.node(nudge.target().id());
            Optional<Operation> moved = history.find(nudge.id().substring(0, nudge.id().length() - suffix.length()));
            if (node == null || !nudged.equals(node.bounds()) || moved.isEmpty()) {
                continue;
            }
            Bounds original = ((NodeUpdatePayload) moved.get().ownPayload()).bounds();
            followUps.add(derivedMove(nudge.id() + RESTORE, moved.get(), original, graph.version()));
        }
    }

    private Operation resolveSameTarget(Operation submitted, List<Conflict> conflicts,
                                        Map<String, Operation> windowById, Map<String, Conflict> resolved,
                                        Map<String, Transition> transitions) {
        List<Conflict> sameTarget = conflicts.stream()
            .filter(c -> c.type() == ConflictType.SAME_TARGET_UPDATE)
            .toList();
        if (sameTarget.isEmpty()) {
            return submitted;
        }
        List<Operation> rivals = sameTarget.stream().map(c -> windowById.get(c.windowOperationId())).toList();

        FieldUpdate mine = (FieldUpdate) submitted.payload();
        Map<String, Object> changes = new LinkedHashMap<>(mine.fieldChanges());
        Operation winner = null;
        boolean overlapped = false;

        for (String path : List.copyOf(changes.keySet())) {
            List<Operation> touching = rivals.stream()
                .filter(r -> KeyPaths.overlapsAny(path, r.ownFieldChanges().keySet()))
                .toList();
            if (touching.isEmpty()) {
                continue;
            }
            overlapped = true;
            Operation best = touching.stream().max(Operation.PRECEDENCE).orElseThrow();
            if (submitted.precedes(best)) {
                changes.remove(path);
                if (winner == null || winner.precedes(best)) {
                    winner = best;
                }
            } else {
                touching.forEach(r -> transitions.putIfAbsent(r.id(), Transition.superseded(r.id(), submitted.id())));
            }
        }

        String resolution = !overlapped ? "field-merge"
            : "last-writer-wins:" + (winner != null ? winner.id() : submitted.id());
        for (Conflict c : sameTarget) {
            resolved.put(c.id(), c.resolvedAs(resolution));
        }
        Operation merged = fold(submitted, changes, rivals);
        return winner != null ? merged.transformed(winner.id()) : merged;
    }

    /**
     * Folds the concurrent changes of the same target into the submission's payload. Every key
     * path takes the value of its highest-precedence writer; paths that came from another
     * operation are recorded in {@link Operation#mergedFrom()} and do not touch the graph again.
     */
    private static Operation fold(Operation submitted, Map<String, Object> own, List<Operation> rivals) {
        FieldUpdate mine = (FieldUpdate) submitted.payload();
        List<Operation> writers = new ArrayList<>(rivals);
        writers.add(submitted);
        writers.sort(Operation.PRECEDENCE);

        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, String> sources = new HashMap<>();
        for (Operation writer : writers) {
            boolean self = writer == submitted;
            Map<String, Object> paths = self ? own : writer.ownFieldChanges();
            for (Map.Entry<String, Object> change : paths.entrySet()) {
                String path = change.getKey();
                if (!self && !representable(mine, path, change.getValue())) {
                    continue;
                }
                merged.keySet().removeIf(existing -> KeyPaths.overlaps(existing, path));
                sources.keySet().removeIf(existing -> KeyPaths.overlaps(existing, path));
                merged.put(path, change.getValue());
                if (!self) {
                    sources.put(path, writer.id());
                }
            }
        }
        return submitted.withPayload(mine.withFieldChanges(merged)).mergedFrom(sources);
    }

    // a node update can carry bounds, a property update only data paths
    private static boolean representable(FieldUpdate payload, String path, Object value) {
        Map<String, Object> single = new HashMap<>();
        single.put(path, value);
        return payload.withFieldChanges(single).fieldChanges().containsKey(path);
    }

    private Operation resolvePosition(Operation submitted, List<Conflict> conflicts, Map<String, Operation> windowById,
                                      WorkflowGraph graph, Map<String, Conflict> resolved, List<Operation> followUps) {
        var payload = (NodeUpdatePayload) submitted.ownPayload();
        Bounds mine = payload.bounds();
        if (mine == null) {
            return submitted;
        }
        Operation higher = null;
        for (Conflict c : conflicts) {
            if (c.type() != ConflictType.POSITION) {
                continue;
            }
            Operation committed = windowById.get(c.windowOperationId());
            Bounds theirs = ((NodeUpdatePayload) committed.ownPayload()).bounds();
            if (submitted.precedes(committed)) {
                mine = nudge(mine, theirs, submitted.authorId(), committed.authorId());
                higher = committed;
                resolved.put(c.id(), c.resolvedAs("position-offset:" + submitted.id()));
                continue;
            }
            NodeState node = graph.node(committed.target().id());
            if (node != null && theirs.equals(node.bounds())) {
                Bounds moved = nudge(theirs, payload.bounds(), committed.authorId(), submitted.authorId());
                followUps.add(derivedMove(committed.id() + NUDGE + submitted.id(), committed, moved, graph.version()));
            }
            resolved.put(c.id(), c.resolvedAs("position-offset:" + committed.id()));
        }
        if (higher != null) {
            // the submission keeps its own bounds; the offset is a separate operation that can be retracted
            followUps.add(0, derivedMove(submitted.id() + NUDGE + higher.id(), submitted, mine, graph.version() + 1));
        }
        return submitted;
    }

    /**
     * Moves {@code lower} horizontally clear of {@code higher}; the side is chosen by author order.
     */
    Bounds nudge(Bounds lower, Bounds higher, String lowerAuthor, String higherAuthor) {
        if (lowerAuthor.compareTo(higherAuthor) <= 0) {
            return lower.withX(higher.x() + higher.width() + positionGap);
        }
        return lower.withX(higher.x() - lower.width() - positionGap);
    }

    private static Operation derivedMove(String id, Operation source, Bounds moved, long headVersion) {
        return derived(id, source, OperationType.NODE_UPDATE, new NodeUpdatePayload(null, moved, null), headVersion);
    }

    private static Operation derived(String id, Operation source, OperationType type, OperationPayload payload,
                                     long headVersion) {
        return new Operation(
            id,
            source.sessionId(),
            source.workflowId(),
            source.authorId(),
            type,
            source.target(),
            payload,
            headVersion,
            null,
            OperationStatus.APPLIED,
            source.timestamp(),
            null,
            null
        );
    }

    /**
     * The effective add of the same target committed in the window, if any.
     */
    private static Optional<Operation> concurrentAdd(Operation add, List<Operation> window) {
        Operation found = null;
        for (Operation committed : window) {
            if (committed.type() == add.type() && committed.target().equals(add.target())) {
                found = committed;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * @param replacing the target was added concurrently, so an existing id is not a duplicate
     */
    private Optional<Resolution> validateAgainst(WorkflowGraph graph, Operation op, boolean replacing,
                                                 List<Conflict> conflicts) {
        String id = op.target().id();
        TargetKind kind = op.target().kind();
        switch (op.type()) {
            case NODE_ADD -> {
                requireKind(op, TargetKind.NODE);
                if (graph.hasNode(id) && !replacing) {
                    throw new InvalidOperationException("Node " + id + " already exists");
                }
            }
            case NODE_UPDATE, NODE_DELETE -> {
                requireKind(op, TargetKind.NODE);
                if (!graph.hasNode(id)) {
                    return Optional.of(missingTarget(op, conflicts));
                }
            }
            case EDGE_ADD -> {
                requireKind(op, TargetKind.EDGE);
                if (graph.hasEdge(id) && !replacing) {
                    throw new InvalidOperationException("Edge " + id + " already exists");
                }
                var p = (EdgeAddPayload) op.payload();
                if (p.source() == null || p.target() == null) {
                    throw new InvalidOperationException("Edge " + id + " needs a source and a target");
                }
                return danglingEndpoint(graph, op, conflicts);
            }
            case EDGE_UPDATE, EDGE_DELETE -> {
                requireKind(op, TargetKind.EDGE);
                if (!graph.hasEdge(id)) {
                    return Optional.of(missingTarget(op, conflicts));
                }
                if (op.payload() instanceof EdgeUpdatePayload) {
                    return danglingEndpoint(graph, op, conflicts);
                }
            }
            case PROPERTY_UPDATE -> {
                if (kind == TargetKind.NODE && !graph.hasNode(id) || kind == TargetKind.EDGE && !graph.hasEdge(id)) {
                    return Optional.of(missingTarget(op, conflicts));
                }
                if (kind == TargetKind.WORKFLOW && !id.equals(op.workflowId())) {
                    throw new InvalidOperationException("Workflow target " + id + " is not " + op.workflowId());
                }
            }
        }
        return Optional.empty();
    }

    private static void requireKind(Operation op, TargetKind expected) {
        if (op.target().kind() != expected) {
            throw new InvalidOperationException(op.type().wireName() + " must target a " + expected.wireName());
        }
    }

    private static Resolution missingTarget(Operation op, List<Conflict> conflicts) {
        return Resolution.rejected(op, RejectionReason.TARGET_DELETED, null,
            describe(op) + " does not exist", conflicts);
    }

    private static Optional<Resolution> danglingEndpoint(WorkflowGraph graph, Operation op, List<Conflict> conflicts) {
        for (String nodeId : ConflictDetector.endpoints(op, graph)) {
            if (!graph.hasNode(nodeId)) {
                return Optional.of(Resolution.rejected(op, RejectionReason.DANGLING_REFERENCE, null,
                    "Endpoint node " + nodeId + " does not exist", conflicts));
            }
        }
        return Optional.empty();
    }

    private static String describe(Operation op) {
        return op.target().kind().wireName() + " " + op.target().id();
    }
}
