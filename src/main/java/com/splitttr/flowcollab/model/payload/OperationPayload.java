package com.splitttr.flowcollab.model.payload;

/**
 * Typed body of an operation. The variant is selected by the operation's {@code type}.
 */
public sealed interface OperationPayload
    permits NodeAddPayload, NodeDeletePayload, EdgeAddPayload, EdgeDeletePayload, FieldUpdate {
}
