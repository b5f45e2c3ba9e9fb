package com.cloudcrud.controller;

import com.cloudcrud.config.CloudCrudProperties;
import com.cloudcrud.dispatch.FunctionDispatcher;
import com.cloudcrud.exception.CloudFunctionException;
import com.cloudcrud.model.result.ErrorResponse;
import com.cloudcrud.model.result.ResponseEnvelope;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP binding for cloud functions.
 * POST /api/v1/functions/{name} with the parameters as a JSON object body.
 */
@RestController
@Slf4j
public class FunctionController {

    @Autowired
    private FunctionDispatcher functionDispatcher;

    @Autowired
    private CloudCrudProperties properties;

    /**
     * Where the API lives
     * HTTP: GET /
     */
    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Cloud functions server running");
        response.put("serverVersion", properties.getServer().getVersion());
        response.put("functionsAPI", "/api/v1/functions");
        response.put("health", "/health");
        return ResponseEntity.ok(response);
    }

    /**
     * Call a function by name
     * HTTP: POST /api/v1/functions/{name}
     */
    @PostMapping("/api/v1/functions/{name}")
    public ResponseEntity<?> callFunction(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> params) {

        log.debug("Calling function {}", name);
        try {
            ResponseEnvelope envelope = functionDispatcher.execute(name, params);
            return ResponseEntity.ok(envelope);
        } catch (CloudFunctionException e) {
            return ResponseEntity.status(e.getKind().getHttpStatus())
                    .body(ErrorResponse.of(e.getKind().getCode(), e.getMessage()));
        }
    }

    /**
     * Liveness probe
     * HTTP: GET /health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("timestamp", Instant.now().truncatedTo(ChronoUnit.MILLIS).toString());
        return ResponseEntity.ok(response);
    }
}
