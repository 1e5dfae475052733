package com.splitttr.flowcollab.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.splitttr.flowcollab.error.InvalidOperationException;
import com.splitttr.flowcollab.model.OperationType;
import com.splitttr.flowcollab.model.payload.OperationPayload;

/**
 * JSON encoding of the channel messages.
 */
public final class MessageCodec {

    private static final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private MessageCodec() {
    }

    public static ClientMessage readClientMessage(String json) {
        try {
            return mapper.readValue(json, ClientMessage.class);
        } catch (JsonProcessingException e) {
            throw new InvalidOperationException("Malformed message: " + e.getOriginalMessage());
        }
    }

    public static String write(Object message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decodes a raw payload into the variant selected by {@code type}. A missing payload is
     * treated as an empty object.
     */
    public static OperationPayload decodePayload(OperationType type, JsonNode payload) {
        JsonNode node = payload == null || payload.isNull() ? mapper.createObjectNode() : payload;
        if (!node.isObject()) {
            throw new InvalidOperationException(type.wireName() + " payload must be an object");
        }
        try {
            return mapper.treeToValue(node, type.payloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidOperationException("Invalid " + type.wireName() + " payload: " + e.getMessage());
        }
    }

    public static ObjectMapper mapper() {
        return mapper;
    }
}
