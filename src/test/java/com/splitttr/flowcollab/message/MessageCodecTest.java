package com.splitttr.flowcollab.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.splitttr.flowcollab.error.InvalidOperationException;
import com.splitttr.flowcollab.model.Bounds;
import com.splitttr.flowcollab.model.OperationType;
import com.splitttr.flowcollab.model.RejectionReason;
import com.splitttr.flowcollab.model.Role;
import com.splitttr.flowcollab.model.SubmissionResult;
import com.splitttr.flowcollab.model.Target;
import com.splitttr.flowcollab.model.payload.NodeUpdatePayload;
import com.splitttr.flowcollab.model.payload.OperationPayload;
import com.splitttr.flowcollab.model.payload.PropertyUpdatePayload;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.splitttr.flowcollab.support.Fixtures.*;

final class MessageCodecTest {

    @Test
    void readsASubmission() {
        ClientMessage msg = MessageCodec.readClientMessage("""
            {"type": "submit_operation",
             "operation": {"id": "op-1", "type": "node_update", "target": {"kind": "node", "id": "a"},
                           "payload": {"bounds": {"x": 10, "y": 20, "width": 100, "height": 50}},
                           "baseVersion": 3, "timestamp": "2026-01-05T10:00:00Z"},
             "clientHint": "ignored"}
            """);

        OperationRequest op = msg.operation();
        Assertions.assertEquals("submit_operation", msg.type());
        Assertions.assertEquals(OperationType.NODE_UPDATE, op.type());
        Assertions.assertEquals(Target.node("a"), op.target());
        Assertions.assertEquals(3, op.baseVersion());
        Assertions.assertEquals(T0, op.timestamp());

        OperationPayload payload = MessageCodec.decodePayload(op.type(), op.payload());
        Assertions.assertEquals(new NodeUpdatePayload(null, new Bounds(10, 20, 100, 50), null), payload);
    }

    @Test
    void readsAJoinWithRoleAndSettings() {
        ClientMessage msg = MessageCodec.readClientMessage("""
            {"type": "join_workflow", "workflowId": "wf-1", "role": "viewer",
             "settings": {"allowedRoles": ["owner", "editor"], "maxParticipants": 4, "autoSave": false}}
            """);

        Assertions.assertEquals(Role.VIEWER, msg.role());
        Assertions.assertEquals(4, msg.settings().maxParticipants());
        Assertions.assertFalse(msg.settings().allows(Role.VIEWER));
    }

    @Test
    void missingPayloadDecodesAsEmpty() {
        Assertions.assertEquals(new PropertyUpdatePayload(Map.of()),
            MessageCodec.decodePayload(OperationType.PROPERTY_UPDATE, null));
    }

    @Test
    void malformedInputIsAnInvalidOperation() {
        Assertions.assertThrows(InvalidOperationException.class, () -> MessageCodec.readClientMessage("{not json"));
        Assertions.assertThrows(InvalidOperationException.class, () -> MessageCodec.readClientMessage(
            "{\"type\": \"submit_operation\", \"operation\": {\"type\": \"node_teleport\"}}"));
        JsonNode array = MessageCodec.mapper().createArrayNode();
        Assertions.assertThrows(InvalidOperationException.class,
            () -> MessageCodec.decodePayload(OperationType.NODE_ADD, array));
    }

    @Test
    void writesWireNamesAndOmitsAbsentFields() throws Exception {
        var rejected = properties("op-1", "bob", 0, Target.node("a"), Map.of("color", "red"))
            .rejected(RejectionReason.TARGET_DELETED);
        var message = ServerMessage.submissionResult(
            SubmissionResult.rejected(rejected, RejectionReason.TARGET_DELETED, "gone", "del-1", List.of()));

        JsonNode json = MessageCodec.mapper().readTree(MessageCodec.write(message));

        Assertions.assertEquals("submission_result", json.get("type").asText());
        Assertions.assertEquals("rejected", json.at("/result/outcome").asText());
        Assertions.assertEquals("target-deleted", json.at("/result/reason").asText());
        Assertions.assertEquals("del-1", json.at("/result/conflictingOperationId").asText());
        Assertions.assertEquals("property_update", json.at("/operation/type").asText());
        Assertions.assertEquals("node", json.at("/operation/target/kind").asText());
        Assertions.assertEquals("red", json.at("/operation/payload/properties/color").asText());
        Assertions.assertEquals("2026-01-05T10:00:00Z", json.at("/operation/timestamp").asText());
        Assertions.assertFalse(json.has("graph"));
        Assertions.assertFalse(json.has("error"));
    }
}
