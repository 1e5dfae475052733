package com.splitttr.flowcollab.graph;

import com.splitttr.flowcollab.model.Bounds;
import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.model.OperationType;
import com.splitttr.flowcollab.model.RejectionReason;
import com.splitttr.flowcollab.model.Target;
import com.splitttr.flowcollab.model.payload.NodeUpdatePayload;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.splitttr.flowcollab.support.Fixtures.*;

final class WorkflowGraphTest {

    @Test
    void nodeDeleteCascadesToAttachedEdges() {
        var graph = new WorkflowGraph(withEdge(withEdge(graph("a", "b", "c"), "ab", "a", "b"), "bc", "b", "c"));

        graph.apply(nodeDelete("op-1", "alice", 1, "a").applied().committedAs(1));

        Assertions.assertFalse(graph.hasNode("a"));
        Assertions.assertFalse(graph.hasEdge("ab"));
        Assertions.assertTrue(graph.hasEdge("bc"));
        Assertions.assertEquals(1, graph.version());
    }

    @Test
    void updatesMergeIntoExistingNodeData() {
        var graph = new WorkflowGraph(graph("a"));

        graph.apply(properties("op-1", "alice", 1, Target.node("a"), Map.of("retry", Map.of("count", 3)))
            .applied().committedAs(1));
        graph.apply(op("op-2", "bob", 2, OperationType.NODE_UPDATE, Target.node("a"),
            new NodeUpdatePayload("Renamed", null, Map.of("retry", Map.of("ms", 50))), 1).applied().committedAs(2));

        NodeState node = graph.node("a");
        Assertions.assertEquals("Renamed", node.label());
        Assertions.assertEquals(new Bounds(0, 0, 100, 50), node.bounds());
        Assertions.assertEquals(Map.of("retry", Map.of("count", 3, "ms", 50)), node.data());
    }

    @Test
    void workflowPropertiesAreUpdatedInPlace() {
        var graph = new WorkflowGraph(GraphSnapshot.empty());

        graph.apply(properties("op-1", "alice", 1, Target.workflow(WORKFLOW), Map.of("timeout", "PT1H"))
            .applied().committedAs(1));

        Assertions.assertEquals(Map.of("timeout", "PT1H"), graph.snapshot().properties());
    }

    @Test
    void replaySkipsRejectedOperationsButKeepsVersion() {
        GraphSnapshot initial = graph("a");
        List<Operation> committed = List.of(
            move("op-1", "alice", 1, "a", new Bounds(500, 0, 100, 50)).rejected(RejectionReason.TARGET_DELETED)
                .committedAs(1),
            nodeAdd("op-2", "bob", 2, "b", new Bounds(0, 300, 100, 50)).applied().committedAs(2)
        );

        GraphSnapshot replayed = WorkflowGraph.replay(initial, committed).snapshot();

        Assertions.assertEquals(new Bounds(0, 0, 100, 50), replayed.nodes().get("a").bounds());
        Assertions.assertTrue(replayed.nodes().containsKey("b"));
        Assertions.assertEquals(2, replayed.version());
    }
}
