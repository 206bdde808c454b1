package com.gateprep.api.controller;

import com.gateprep.llm.provider.LlmProvider;
import com.gateprep.llm.router.FailoverLlmRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/llm")
@RequiredArgsConstructor
public class LlmStatsController {

    private final FailoverLlmRouter llmRouter;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        return ResponseEntity.ok(llmRouter.getStatistics());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        List<String> configured = llmRouter.availableProviders().stream()
            .map(LlmProvider::getDisplayName)
            .collect(Collectors.toList());
        boolean healthy = !configured.isEmpty();

        return ResponseEntity.status(healthy ? 200 : 503).body(Map.of(
            "status", healthy ? "UP" : "DOWN",
            "configuredProviders", configured,
            "mode", healthy ? "generate" : "cache-only"
        ));
    }
}
