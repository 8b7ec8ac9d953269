package com.stellar.gateway.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness endpoints used by load balancers and the web client's "is the service up" check.
 */
@RestController
@Tag(name = "Status", description = "Service liveness")
public class StatusController {

    static final String GREETING = "Hello from the Stellar transaction service!";

    @GetMapping("/")
    @Operation(summary = "Home", description = "Always returns {\"success\": true}")
    public ResponseEntity<Map<String, Object>> home() {
        return ResponseEntity.ok(Map.of("success", true));
    }

    @GetMapping("/api")
    @Operation(summary = "API greeting")
    public ResponseEntity<Map<String, String>> api() {
        return ResponseEntity.ok(Map.of("message", GREETING));
    }
}
