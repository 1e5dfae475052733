package com.splitttr.flowcollab.message;

import com.splitttr.flowcollab.model.Presence;
import com.splitttr.flowcollab.model.Role;
import com.splitttr.flowcollab.model.SessionSettings;

public record ClientMessage(
    String type,            // "join_workflow", "leave_workflow", "submit_operation", "presence_update",
                            // "fetch_operations", "update_settings", "end_session", "session_stats"
    String workflowId,
    Role role,
    SessionSettings settings,
    OperationRequest operation,
    Presence presence,
    Long fromVersion,
    Long toVersion
) {}
