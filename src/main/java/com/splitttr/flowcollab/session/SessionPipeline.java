package com.splitttr.flowcollab.session;

import com.splitttr.flowcollab.broadcast.BroadcastCoordinator;
import com.splitttr.flowcollab.config.CollabConfig;
import com.splitttr.flowcollab.conflict.ConflictDetector;
import com.splitttr.flowcollab.error.BusyException;
import com.splitttr.flowcollab.error.CollabException;
import com.splitttr.flowcollab.error.ErrorCode;
import com.splitttr.flowcollab.error.SessionClosedException;
import com.splitttr.flowcollab.graph.GraphSnapshot;
import com.splitttr.flowcollab.graph.WorkflowGraph;
import com.splitttr.flowcollab.log.CommitHistory;
import com.splitttr.flowcollab.log.OperationLog;
import com.splitttr.flowcollab.message.ServerMessage;
import com.splitttr.flowcollab.model.Conflict;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.SubmissionResult;
import com.splitttr.flowcollab.store.CollaborationStore;
import com.splitttr.flowcollab.transform.Resolution;
import com.splitttr.flowcollab.transform.TransformEngine;
import com.splitttr.flowcollab.transform.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single-writer commit pipeline of one session.
 *
 * <p>Submissions are queued (bounded; a full queue answers {@code Busy}) and processed one at
 * a time on the session's own thread: conflict detection, transform, append, graph update and
 * broadcast happen without interleaving from another operation of the same session. Sessions do
 * not share a pipeline, so they proceed in parallel.
 */
public class SessionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SessionPipeline.class);

    private final WorkflowSession session;
    private final OperationLog log;
    private final CommitHistory history;
    private final GraphSnapshot initial;
    private final WorkflowGraph graph;
    private final CollabConfig config;
    private final ConflictDetector detector;
    private final TransformEngine engine;
    private final BroadcastCoordinator coordinator;
    private final CollaborationStore store;
    private final Executor background;
    private final ThreadPoolExecutor worker;

    // guards the graph against snapshot readers on other threads
    private final Object stateLock = new Object();

    public SessionPipeline(WorkflowSession session, GraphSnapshot initial, CollabConfig config,
                           ConflictDetector detector, TransformEngine engine, BroadcastCoordinator coordinator,
                           CollaborationStore store, Executor background) {
        this.session = session;
        this.log = new OperationLog(session.sessionId());
        this.initial = new GraphSnapshot(initial.nodes(), initial.edges(), initial.properties(), 0);
        this.graph = new WorkflowGraph(this.initial);
        this.history = new CommitHistory(this.initial, log);
        this.config = config;
        this.detector = detector;
        this.engine = engine;
        this.coordinator = coordinator;
        this.store = store;
        this.background = background;
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(config.queueDepth()),
            r -> {
                Thread t = new Thread(r, "collab-pipeline-" + session.sessionId());
                t.setDaemon(true);
                return t;
            });
        session.attach(this);
    }

    /**
     * Queues a submission. The future fails with {@link BusyException} when the queue is full and
     * with {@link SessionClosedException} once the session has ended. Every failure is also queued
     * to the author as an {@code error} message, behind anything already sent to them.
     */
    public CompletableFuture<SubmissionResult> submit(Operation op) {
        CompletableFuture<SubmissionResult> future = new CompletableFuture<>();
        try {
            worker.execute(() -> {
                try {
                    future.complete(process(op));
                } catch (CollabException e) {
                    fail(op, future, e, ServerMessage.error(e.code().name(), e.getMessage()));
                } catch (RuntimeException e) {
                    LOG.error("Pipeline failure on operation {} in session {}", op.id(), session.sessionId(), e);
                    fail(op, future, e, ServerMessage.error(ErrorCode.INTERNAL.name(), "Internal error"));
                }
            });
        } catch (RejectedExecutionException e) {
            CollabException refused = worker.isShutdown()
                ? new SessionClosedException(session.sessionId())
                : new BusyException(session.sessionId());
            fail(op, future, refused, ServerMessage.error(refused.code().name(), refused.getMessage()));
        }
        return future;
    }

    private void fail(Operation op, CompletableFuture<SubmissionResult> future, RuntimeException e,
                      ServerMessage error) {
        coordinator.sendTo(session, op.authorId(), error);
        future.completeExceptionally(e);
    }

    SubmissionResult process(Operation op) {
        if (!session.isActive()) {
            throw new SessionClosedException(session.sessionId());
        }
        synchronized (stateLock) {
            var known = log.find(op.id());
            if (known.isPresent()) {
                return resultOf(known.get());
            }

            engine.checkBaseVersion(op, log.headVersion(), config.retainedWindow());
            List<Operation> window = log.window(op.baseVersion());
            List<Conflict> conflicts = detector.detect(op, window, graph);
            Resolution resolution = engine.resolve(op, conflicts, window, graph, history);

            resolution.conflicts().forEach(c -> coordinator.publishConflict(session, c));

            if (resolution.isRejected()) {
                return reject(resolution);
            }
            return commit(resolution);
        }
    }

    private SubmissionResult reject(Resolution resolution) {
        Operation rejected = resolution.operation();
        String conflicting = resolution.conflictingOperationId() != null
            ? resolution.conflictingOperationId()
            : lastDeleteOf(rejected);
        log.recordRejected(rejected);
        var result = SubmissionResult.rejected(rejected, resolution.reason(), resolution.detail(),
            conflicting, resolution.conflicts());
        coordinator.publishRejection(session, result);
        LOG.debug("Rejected {} {} in session {}: {}", rejected.type().wireName(), rejected.id(),
            session.sessionId(), resolution.reason().wireName());
        return result;
    }

    private SubmissionResult commit(Resolution resolution) {
        long version = log.append(resolution.operation());
        Operation committed = log.at(version);
        graph.apply(committed);
        var result = SubmissionResult.committed(committed, resolution.conflicts());
        coordinator.publish(session, result);
        writeThrough(committed);

        for (Transition transition : resolution.transitions()) {
            Operation changed = log.transition(transition.operationId(), transition::applyTo);
            coordinator.publishStatus(session, changed);
            writeThrough(changed);
        }
        for (Operation derived : resolution.followUps()) {
            Operation applied = log.at(log.appendDerived(derived));
            graph.apply(applied);
            coordinator.publishDerived(session, applied);
            writeThrough(applied);
        }
        LOG.debug("Committed {} {} as v{} in session {} ({})", committed.type().wireName(), committed.id(),
            version, session.sessionId(), committed.status().wireName());
        return result;
    }

    private String lastDeleteOf(Operation op) {
        List<Operation> history = log.byTarget(op.target().kind(), op.target().id());
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).type().isDelete()) {
                return history.get(i).id();
            }
        }
        return null;
    }

    private static SubmissionResult resultOf(Operation known) {
        if (known.status().isEffective()) {
            return SubmissionResult.committed(known, List.of());
        }
        return SubmissionResult.rejected(known, known.rejection(), "Already processed", null, List.of());
    }

    private void writeThrough(Operation op) {
        if (session.settings().autoSave()) {
            background.execute(() -> store.saveOperation(op));
        }
    }

    public OperationLog log() {
        return log;
    }

    public long headVersion() {
        return log.headVersion();
    }

    public GraphSnapshot initialGraph() {
        return initial;
    }

    /**
     * Consistent copy of the live graph; its version is the head version it reflects.
     */
    public GraphSnapshot snapshot() {
        synchronized (stateLock) {
            return graph.snapshot();
        }
    }

    /**
     * Runs {@code action} with no commit in progress, so nothing is appended or broadcast meanwhile.
     */
    <T> T exclusive(Supplier<T> action) {
        synchronized (stateLock) {
            return action.get();
        }
    }

    /**
     * Rebuilds the graph from the initial state and the committed log.
     */
    public GraphSnapshot replay() {
        synchronized (stateLock) {
            return history.replay().snapshot();
        }
    }

    /**
     * Stops accepting work. Operations already queued fail with {@link SessionClosedException}.
     */
    void close() {
        log.close();
        worker.shutdown();
    }
}
