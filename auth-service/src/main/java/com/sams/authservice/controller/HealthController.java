package com.sams.authservice.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "health")
public class HealthController {

    @GetMapping("/health")
    @Operation(summary = "Liveness check")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
