package com.splitttr.flowcollab.model;

import java.util.EnumSet;
import java.util.Set;

public record SessionSettings(
    Set<Role> allowedRoles,
    int maxParticipants,
    boolean autoSave
) {
    public SessionSettings {
        allowedRoles = allowedRoles == null || allowedRoles.isEmpty()
            ? Set.copyOf(EnumSet.allOf(Role.class))
            : Set.copyOf(allowedRoles);
    }

    public boolean allows(Role role) {
        return allowedRoles.contains(role);
    }
}
