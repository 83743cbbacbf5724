package com.sams.authservice.controller;

import com.sams.authservice.config.OpenApiConfig;
import com.sams.authservice.dto.UpdateActiveRequest;
import com.sams.authservice.dto.UpdateRoleRequest;
import com.sams.authservice.dto.UserResponse;
import com.sams.authservice.model.Role;
import com.sams.authservice.security.AccessGuard;
import com.sams.authservice.security.AccessPolicy;
import com.sams.authservice.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
@SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
@Tag(name = "User Management", description = "Admin endpoints for role and account status")
public class UserManagementController {

    private static final AccessPolicy ADMIN_ONLY = AccessPolicy.role(Role.ADMIN);

    private final UserService userService;
    private final AccessGuard accessGuard;

    @GetMapping
    @Operation(summary = "List all users")
    public ResponseEntity<List<UserResponse>> getAllUsers(HttpServletRequest request) {
        accessGuard.require(request, ADMIN_ONLY);
        return ResponseEntity.ok(userService.findAll().stream()
                .map(UserResponse::from)
                .collect(Collectors.toList()));
    }

    @PatchMapping("/{id}/active")
    @Operation(summary = "Activate or deactivate a user")
    public ResponseEntity<UserResponse> setActive(HttpServletRequest request, @PathVariable Long id,
                                                  @Valid @RequestBody UpdateActiveRequest body) {
        accessGuard.require(request, ADMIN_ONLY);
        return ResponseEntity.ok(UserResponse.from(userService.setActive(id, body.getActive())));
    }

    @PatchMapping("/{id}/role")
    @Operation(summary = "Change the role of a user")
    public ResponseEntity<UserResponse> changeRole(HttpServletRequest request, @PathVariable Long id,
                                                   @Valid @RequestBody UpdateRoleRequest body) {
        accessGuard.require(request, ADMIN_ONLY);
        return ResponseEntity.ok(UserResponse.from(userService.changeRole(id, body.getRole())));
    }
}
