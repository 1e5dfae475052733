package com.splitttr.flowcollab.store;

import com.splitttr.flowcollab.client.WorkflowGraphResponse;
import com.splitttr.flowcollab.client.WorkflowServiceClient;
import com.splitttr.flowcollab.graph.EdgeState;
import com.splitttr.flowcollab.graph.GraphSnapshot;
import com.splitttr.flowcollab.graph.NodeState;
import com.splitttr.flowcollab.model.Bounds;
import com.splitttr.flowcollab.model.Operation;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.splitttr.flowcollab.support.Fixtures.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
final class RemoteCollaborationStoreTest {

    @Mock
    WorkflowServiceClient workflowService;

    private final RemoteCollaborationStore store = new RemoteCollaborationStore();

    @BeforeEach
    void wire() {
        store.workflowService = workflowService;
    }

    @Test
    void loadsTheGraphIndexedById() {
        var node = new NodeState("a", "task", "A", new Bounds(0, 0, 100, 50), null);
        var edge = new EdgeState("e1", "a", "b", null, Map.of("weight", 2));
        when(workflowService.getGraph(WORKFLOW)).thenReturn(
            new WorkflowGraphResponse(WORKFLOW, List.of(node), List.of(edge), null, T0, 42));

        GraphSnapshot graph = store.loadGraph(WORKFLOW);

        Assertions.assertEquals(Map.of(), graph.nodes().get("a").data());
        Assertions.assertEquals("b", graph.edges().get("e1").target());
        Assertions.assertEquals(Map.of(), graph.properties());
        Assertions.assertEquals(0, graph.version());
    }

    @Test
    void unreachableServiceStartsFromAnEmptyGraph() {
        when(workflowService.getGraph(anyString())).thenThrow(new IllegalStateException("connection refused"));

        GraphSnapshot graph = store.loadGraph(WORKFLOW);

        Assertions.assertTrue(graph.nodes().isEmpty());
        Assertions.assertTrue(graph.edges().isEmpty());
    }

    @Test
    void missingResponseIsAnEmptyGraph() {
        Assertions.assertTrue(RemoteCollaborationStore.toSnapshot(null).nodes().isEmpty());
    }

    @Test
    void writeFailuresAreNotPropagated() {
        Operation op = move("op-1", "alice", 0, "a", new Bounds(10, 10, 100, 50));
        doThrow(new IllegalStateException("503")).when(workflowService).appendOperation(anyString(), any());
        doThrow(new IllegalStateException("503")).when(workflowService).saveSession(anyString(), any());
        var document = new SessionDocument(SESSION, WORKFLOW, "alice", T0, List.of(), settings(5, true), null, 0, T0);

        Assertions.assertDoesNotThrow(() -> store.saveOperation(op));
        Assertions.assertDoesNotThrow(() -> store.saveSession(document));
        verify(workflowService).appendOperation(WORKFLOW, op);
        verify(workflowService).saveSession(SESSION, document);
    }
}
