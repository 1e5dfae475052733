package com.splitttr.flowcollab.security;

import com.splitttr.flowcollab.model.Role;

/**
 * Verified identity of the user behind a connection. {@code role} is {@code null} when the token
 * carries none.
 */
public record Caller(String userId, Role role, boolean admin) {}
