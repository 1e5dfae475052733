package com.splitttr.flowcollab.security;

import com.splitttr.flowcollab.model.Role;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

final class AuthServiceTest {

    @Test
    void strongestGroupRoleWins() {
        Caller caller = AuthService.toCaller("alice", Set.of("viewer", "owner", "editor"));

        Assertions.assertEquals("alice", caller.userId());
        Assertions.assertEquals(Role.OWNER, caller.role());
        Assertions.assertFalse(caller.admin());
    }

    @Test
    void adminGroupGrantsAdministrationWithoutARole() {
        Caller caller = AuthService.toCaller("root", Set.of("admin"));

        Assertions.assertTrue(caller.admin());
        Assertions.assertNull(caller.role());
    }

    @Test
    void unrelatedGroupsGrantNothing() {
        Caller caller = AuthService.toCaller("bob", Set.of("billing"));

        Assertions.assertNull(caller.role());
        Assertions.assertFalse(caller.admin());
    }
}
