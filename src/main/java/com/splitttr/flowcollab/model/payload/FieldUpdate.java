package com.splitttr.flowcollab.model.payload;

import java.util.Map;

/**
 * Payload that mutates individual fields of an existing target and can therefore be merged
 * field by field with a concurrent update of the same target.
 */
public sealed interface FieldUpdate extends OperationPayload
    permits NodeUpdatePayload, EdgeUpdatePayload, PropertyUpdatePayload {

    /**
     * Leaf key paths mutated by this payload, mapped to their new values.
     */
    Map<String, Object> fieldChanges();

    /**
     * Rebuilds a payload of the same variant that mutates exactly the given key paths.
     */
    FieldUpdate withFieldChanges(Map<String, Object> changes);
}
