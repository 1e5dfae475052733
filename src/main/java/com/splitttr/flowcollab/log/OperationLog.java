package com.splitttr.flowcollab.log;

import com.splitttr.flowcollab.error.SessionClosedException;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.OperationStatus;
import com.splitttr.flowcollab.model.TargetKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Append-only ledger of one session's operations.
 *
 * <p>Committed operations are numbered 1, 2, 3... without gaps; {@link #append} is the only
 * place a {@code committedVersion} is assigned and must be called from the session's commit
 * pipeline. Rejected submissions are kept in the audit trail but never receive a version.
 * Reads may come from any thread.
 */
public class OperationLog {

    private final String sessionId;
    private final List<Operation> committed = new ArrayList<>();
    private final List<Operation> audit = new ArrayList<>();
    private final Map<String, Integer> committedIndex = new HashMap<>();
    private final Set<String> derived = new HashSet<>();
    private boolean closed;

    public OperationLog(String sessionId) {
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Commits {@code op} with the next version and returns that version.
     *
     * @throws SessionClosedException if the session has ended
     */
    public synchronized long append(Operation op) {
        if (closed) {
            throw new SessionClosedException(sessionId);
        }
        if (committedIndex.containsKey(op.id())) {
            throw new IllegalStateException("Operation " + op.id() + " already committed");
        }
        long version = committed.size() + 1L;
        Operation entry = op.committedAs(version);
        committed.add(entry);
        committedIndex.put(op.id(), committed.size() - 1);
        audit.add(entry);
        return version;
    }

    /**
     * Commits a follow-up the pipeline derived from a submission, such as a position nudge.
     * It is versioned like any other operation but is not counted as a participant submission.
     */
    public synchronized long appendDerived(Operation op) {
        long version = append(op);
        derived.add(op.id());
        return version;
    }

    /**
     * Records a rejected submission for audit. It is never part of {@link #range}.
     */
    public synchronized void recordRejected(Operation op) {
        if (op.status() != OperationStatus.REJECTED) {
            throw new IllegalArgumentException("Only rejected operations are recorded without a version");
        }
        audit.add(op);
    }

    /**
     * Replaces the status of an already committed operation; its version and position are kept.
     */
    public synchronized Operation transition(String operationId, UnaryOperator<Operation> change) {
        Integer index = committedIndex.get(operationId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown committed operation " + operationId);
        }
        Operation updated = change.apply(committed.get(index));
        committed.set(index, updated);
        return updated;
    }

    public synchronized long headVersion() {
        return committed.size();
    }

    public synchronized Optional<Operation> find(String operationId) {
        Integer index = committedIndex.get(operationId);
        if (index != null) {
            return Optional.of(committed.get(index));
        }
        return audit.stream().filter(op -> op.id().equals(operationId)).findFirst();
    }

    public synchronized Operation at(long version) {
        return committed.get((int) version - 1);
    }

    /**
     * Committed operations with {@code fromVersion <= committedVersion <= toVersion}, in commit order.
     */
    public synchronized List<Operation> range(long fromVersion, long toVersion) {
        int from = (int) Math.max(1, fromVersion);
        int to = (int) Math.min(committed.size(), toVersion);
        if (from > to) {
            return List.of();
        }
        return List.copyOf(committed.subList(from - 1, to));
    }

    /**
     * The concurrent window of a submission computed against {@code baseVersion}: operations
     * committed after it that still contribute to the workflow state.
     */
    public synchronized List<Operation> window(long baseVersion) {
        List<Operation> out = new ArrayList<>();
        for (int i = (int) Math.max(0, baseVersion); i < committed.size(); i++) {
            Operation op = committed.get(i);
            if (op.status().isEffective()) {
                out.add(op);
            }
        }
        return out;
    }

    public synchronized List<Operation> byTarget(TargetKind kind, String targetId) {
        return committed.stream().filter(op -> op.targets(kind, targetId)).toList();
    }

    /**
     * Every submission seen by the session, committed or rejected, in arrival order.
     */
    public synchronized List<Operation> audit() {
        return audit.stream()
            .map(op -> op.committedVersion() != null ? committed.get(committedIndex.get(op.id())) : op)
            .toList();
    }

    /**
     * Participant submissions that are committed and still contribute to the workflow state.
     */
    public synchronized long effectiveCount() {
        return committed.stream()
            .filter(op -> op.status().isEffective() && !derived.contains(op.id()))
            .count();
    }

    /**
     * Participant submissions rejected on arrival or after they were committed.
     */
    public synchronized long rejectedCount() {
        return audit.stream().filter(op -> op.committedVersion() == null).count()
            + committed.stream()
                .filter(op -> op.status() == OperationStatus.REJECTED && !derived.contains(op.id()))
                .count();
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
