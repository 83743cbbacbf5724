package com.sams.authservice.exception;

import com.sams.authservice.model.Role;
import lombok.Getter;

import java.util.Set;

@Getter
public class ForbiddenException extends RuntimeException {

    private final Set<Role> requiredRoles;

    public ForbiddenException(Set<Role> requiredRoles) {
        super("Insufficient privileges");
        this.requiredRoles = Set.copyOf(requiredRoles);
    }
}
