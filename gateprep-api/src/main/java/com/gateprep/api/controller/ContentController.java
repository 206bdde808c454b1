package com.gateprep.api.controller;

import com.gateprep.api.dto.response.ContentResponse;
import com.gateprep.api.dto.response.ErrorResponse;
import com.gateprep.common.constants.ContentKind;
import com.gateprep.common.constants.Difficulty;
import com.gateprep.common.constants.TopicCode;
import com.gateprep.common.model.ContentRequest;
import com.gateprep.core.model.ContentResult;
import com.gateprep.core.service.ContentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/content")
@RequiredArgsConstructor
@Slf4j
public class ContentController {

    static final String UNAVAILABLE_MESSAGE =
        "Could not fetch new content right now and nothing is cached yet. Please try again in a few minutes.";

    private final ContentService contentService;

    @GetMapping("/topics")
    public ResponseEntity<List<Map<String, String>>> getTopics() {
        List<Map<String, String>> topics = new ArrayList<>();
        TopicCode.catalogue().forEach((code, name) -> {
            Map<String, String> topic = new LinkedHashMap<>();
            topic.put("code", code);
            topic.put("name", name);
            topics.add(topic);
        });
        return ResponseEntity.ok(topics);
    }

    /**
     * Fetches one piece of content, e.g. {@code GET /api/v1/content/question?topic=GEO&difficulty=hard}.
     */
    @GetMapping("/{kind}")
    public ResponseEntity<?> getContent(
            @PathVariable String kind,
            @RequestParam(required = false) String topic,
            @RequestParam(required = false) String difficulty
    ) {
        ContentKind contentKind = ContentKind.fromString(kind);
        ContentRequest request = ContentRequest.builder()
            .kind(contentKind)
            .topicCode(topic)
            .difficulty(difficulty == null || difficulty.isBlank() ? null : Difficulty.fromString(difficulty))
            .build();

        ContentResult result = contentService.getContent(request);

        if (!result.isAvailable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.builder()
                .message(UNAVAILABLE_MESSAGE)
                .error("CONTENT_UNAVAILABLE")
                .status(HttpStatus.SERVICE_UNAVAILABLE.value())
                .timestamp(Instant.now())
                .path("/api/v1/content/" + contentKind.getWireKey())
                .build());
        }

        return ResponseEntity.ok(ContentResponse.from(result, request.getTopicDisplayName()));
    }
}
