package com.splitttr.flowcollab.model.payload;

public record NodeDeletePayload() implements OperationPayload {}
