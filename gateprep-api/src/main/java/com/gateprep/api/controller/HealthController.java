package com.gateprep.api.controller;

import com.gateprep.common.constants.ContentKind;
import com.gateprep.core.cache.ContentCache;
import com.gateprep.llm.router.FailoverLlmRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness plus a summary of what the bot can currently serve.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final ContentCache contentCache;
    private final FailoverLlmRouter llmRouter;

    private static final Instant startTime = Instant.now();

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> cacheSizes = new LinkedHashMap<>();
        contentCache.sizes().forEach((kind, size) -> cacheSizes.put(kind.getWireKey(), size));

        boolean canGenerate = llmRouter.hasConfiguredProviders();
        boolean hasCache = cacheSizes.values().stream().anyMatch(size -> (Integer) size > 0);

        Map<String, Object> response = new HashMap<>();
        response.put("status", canGenerate || hasCache ? "UP" : "DEGRADED");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "gateprep-content");
        response.put("uptime", getUptime());
        response.put("providersConfigured", canGenerate);
        response.put("cache", cacheSizes);
        response.put("cacheCapacityPerKind", contentCache.getMaxEntriesPerKind());
        response.put("contentKinds", ContentKind.values().length);

        return ResponseEntity.ok(response);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("pong");
    }

    private String getUptime() {
        long seconds = Instant.now().getEpochSecond() - startTime.getEpochSecond();
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (days > 0) {
            return String.format("%dd %dh %dm %ds", days, hours, minutes, secs);
        } else if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        }
        return String.format("%dm %ds", minutes, secs);
    }
}
