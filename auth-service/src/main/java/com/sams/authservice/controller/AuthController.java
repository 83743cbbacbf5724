package com.sams.authservice.controller;

import com.sams.authservice.config.OpenApiConfig;
import com.sams.authservice.dto.LoginRequest;
import com.sams.authservice.dto.RegisterRequest;
import com.sams.authservice.dto.TokenResponse;
import com.sams.authservice.dto.UserResponse;
import com.sams.authservice.model.User;
import com.sams.authservice.security.AccessGuard;
import com.sams.authservice.security.AccessPolicy;
import com.sams.authservice.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Registration, login and current user")
public class AuthController {

    private final AuthService authService;
    private final AccessGuard accessGuard;

    @PostMapping("/register")
    @Operation(summary = "Register a new user")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.ok(authService.register(request));
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Log in with email and password (JSON body)")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    @Operation(summary = "Log in with email and password (form fields)")
    public ResponseEntity<TokenResponse> loginForm(@Valid @ModelAttribute LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @GetMapping("/me")
    @Operation(summary = "Current authenticated user", security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    public ResponseEntity<UserResponse> me(HttpServletRequest request) {
        User user = accessGuard.require(request, AccessPolicy.authenticated());
        return ResponseEntity.ok(UserResponse.from(user));
    }
}
