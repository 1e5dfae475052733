package com.splitttr.flowcollab.store;

import com.splitttr.flowcollab.client.WorkflowGraphResponse;
import com.splitttr.flowcollab.client.WorkflowServiceClient;
import com.splitttr.flowcollab.graph.EdgeState;
import com.splitttr.flowcollab.graph.GraphSnapshot;
import com.splitttr.flowcollab.graph.NodeState;
import com.splitttr.flowcollab.model.Operation;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CollaborationStore} backed by the workflow service. Failures are logged and swallowed
 * into defaults: persistence must never block or fail a commit.
 */
@ApplicationScoped
public class RemoteCollaborationStore implements CollaborationStore {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteCollaborationStore.class);

    @Inject
    @RestClient
    WorkflowServiceClient workflowService;

    @Override
    public GraphSnapshot loadGraph(String workflowId) {
        try {
            return toSnapshot(workflowService.getGraph(workflowId));
        } catch (Exception e) {
            LOG.warn("Could not load graph of workflow {}, starting empty: {}", workflowId, e.getMessage());
            return GraphSnapshot.empty();
        }
    }

    @Override
    public void saveOperation(Operation operation) {
        try {
            workflowService.appendOperation(operation.workflowId(), operation);
        } catch (Exception e) {
            LOG.warn("Failed to persist operation {} of session {}: {}", operation.id(),
                operation.sessionId(), e.getMessage());
        }
    }

    @Override
    public void saveSession(SessionDocument session) {
        try {
            workflowService.saveSession(session.sessionId(), session);
        } catch (Exception e) {
            LOG.warn("Failed to persist session {}: {}", session.sessionId(), e.getMessage());
        }
    }

    static GraphSnapshot toSnapshot(WorkflowGraphResponse response) {
        if (response == null) {
            return GraphSnapshot.empty();
        }
        Map<String, NodeState> nodes = new LinkedHashMap<>();
        for (NodeState node : orEmpty(response.nodes())) {
            nodes.put(node.id(), new NodeState(node.id(), node.nodeType(), node.label(), node.bounds(),
                node.data() == null ? Map.of() : node.data()));
        }
        Map<String, EdgeState> edges = new LinkedHashMap<>();
        for (EdgeState edge : orEmpty(response.edges())) {
            edges.put(edge.id(), new EdgeState(edge.id(), edge.source(), edge.target(), edge.label(),
                edge.data() == null ? Map.of() : edge.data()));
        }
        Map<String, Object> properties = response.properties() == null
            ? Map.of()
            : new LinkedHashMap<>(response.properties());
        return new GraphSnapshot(nodes, edges, properties, 0);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
