package com.splitttr.flowcollab.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.splitttr.flowcollab.model.OperationType;
import com.splitttr.flowcollab.model.Target;

import java.time.Instant;

/**
 * Operation as submitted by a client. The payload stays raw until its {@code type} is known.
 */
public record OperationRequest(
    String id,
    OperationType type,
    Target target,
    JsonNode payload,
    long baseVersion,
    Instant timestamp
) {}
