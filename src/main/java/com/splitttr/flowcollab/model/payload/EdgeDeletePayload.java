package com.splitttr.flowcollab.model.payload;

public record EdgeDeletePayload() implements OperationPayload {}
