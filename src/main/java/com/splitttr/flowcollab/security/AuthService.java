package com.splitttr.flowcollab.security;

import com.splitttr.flowcollab.model.Role;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;

import java.util.Set;

@ApplicationScoped
public class AuthService {

    static final String ADMIN_GROUP = "admin";

    @Inject
    JsonWebToken jwt;

    /**
     * Get the current user's ID from the JWT subject.
     * Returns null if not authenticated.
     */
    public String getCurrentUserId() {
        try {
            return jwt.getSubject();
        } catch (Exception e) {
            return null;
        }
    }

    public boolean isAuthenticated() {
        return getCurrentUserId() != null;
    }

    public Caller currentCaller() {
        Set<String> groups = jwt.getGroups();
        return toCaller(getCurrentUserId(), groups == null ? Set.of() : groups);
    }

    /**
     * Maps token groups to a collaboration role; the strongest role wins.
     */
    static Caller toCaller(String userId, Set<String> groups) {
        Role role = null;
        for (Role candidate : Role.values()) {
            if (groups.contains(candidate.wireName())) {
                role = candidate;
            }
        }
        return new Caller(userId, role, groups.contains(ADMIN_GROUP));
    }
}
