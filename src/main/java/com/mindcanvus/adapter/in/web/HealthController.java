package com.mindcanvus.adapter.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@Tag(name = "Health", description = "Liveness check")
public class HealthController {

    private final Clock clock;

    public HealthController(Clock clock) {
        this.clock = clock;
    }

    @GetMapping("/api/health")
    @Operation(summary = "Health check", description = "Returns OK while the application is serving requests")
    public HealthResponse health() {
        return new HealthResponse("OK", clock.instant());
    }

    public record HealthResponse(String status, Instant timestamp) {}
}
