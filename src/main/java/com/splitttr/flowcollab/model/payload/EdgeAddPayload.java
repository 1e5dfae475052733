package com.splitttr.flowcollab.model.payload;

import java.util.Map;

public record EdgeAddPayload(
    String source,
    String target,
    String label,
    Map<String, Object> data
) implements OperationPayload {
    public EdgeAddPayload {
        data = data == null ? Map.of() : data;
    }
}
