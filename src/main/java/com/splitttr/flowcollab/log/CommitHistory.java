package com.splitttr.flowcollab.log;

import com.splitttr.flowcollab.graph.GraphSnapshot;
import com.splitttr.flowcollab.graph.WorkflowGraph;
import com.splitttr.flowcollab.model.Operation;

import java.util.Optional;
import java.util.Set;

/**
 * Read view over a session's committed history: lookups by id and what-if replays of the log.
 */
public class CommitHistory {

    private final GraphSnapshot initial;
    private final OperationLog log;

    public CommitHistory(GraphSnapshot initial, OperationLog log) {
        this.initial = initial;
        this.log = log;
    }

    public Optional<Operation> find(String operationId) {
        return log.find(operationId);
    }

    /**
     * The graph the committed log produces.
     */
    public WorkflowGraph replay() {
        return WorkflowGraph.replay(initial, log.range(1, log.headVersion()));
    }

    /**
     * The graph the committed log would produce if the given operations had never been applied.
     */
    public WorkflowGraph replayWithout(Set<String> excluded) {
        var graph = new WorkflowGraph(initial);
        for (Operation op : log.range(1, log.headVersion())) {
            if (!excluded.contains(op.id())) {
                graph.apply(op);
            }
        }
        return graph;
    }
}
