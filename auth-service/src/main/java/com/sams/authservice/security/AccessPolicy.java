package com.sams.authservice.security;

import com.sams.authservice.model.Role;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Who may call a handler, as a value: any authenticated user, exactly one role,
 * or any role from a set.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AccessPolicy {

    public enum Kind {
        ANY_AUTHENTICATED,
        EXACT_ROLE,
        ANY_OF_ROLES
    }

    private static final AccessPolicy AUTHENTICATED = new AccessPolicy(Kind.ANY_AUTHENTICATED, Set.of());

    private final Kind kind;
    private final Set<Role> roles;

    private AccessPolicy(Kind kind, Set<Role> roles) {
        this.kind = kind;
        this.roles = roles;
    }

    public static AccessPolicy authenticated() {
        return AUTHENTICATED;
    }

    public static AccessPolicy role(Role role) {
        return new AccessPolicy(Kind.EXACT_ROLE, Set.of(role));
    }

    public static AccessPolicy anyRole(Role first, Role... others) {
        EnumSet<Role> allowed = EnumSet.of(first);
        allowed.addAll(Arrays.asList(others));
        return new AccessPolicy(Kind.ANY_OF_ROLES, Set.copyOf(allowed));
    }

    public boolean permits(Role role) {
        switch (kind) {
            case ANY_AUTHENTICATED:
                return true;
            case EXACT_ROLE:
            case ANY_OF_ROLES:
                return role != null && roles.contains(role);
            default:
                throw new IllegalStateException("Unknown policy kind " + kind);
        }
    }
}
