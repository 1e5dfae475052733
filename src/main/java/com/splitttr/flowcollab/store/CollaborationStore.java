package com.splitttr.flowcollab.store;

import com.splitttr.flowcollab.graph.GraphSnapshot;
import com.splitttr.flowcollab.model.Operation;

/**
 * Durable home of committed operations and session documents. Write-through only: the
 * session pipeline stays the source of truth for in-flight ordering.
 */
public interface CollaborationStore {

    /**
     * Current graph of a workflow, or an empty graph when it cannot be loaded.
     */
    GraphSnapshot loadGraph(String workflowId);

    void saveOperation(Operation operation);

    void saveSession(SessionDocument session);
}
