package com.gateprep.api.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.common.constants.ContentKind;
import com.gateprep.core.cache.ContentCache;
import com.gateprep.core.model.GeneratedContent;
import com.gateprep.core.parser.ContentBinder;
import com.gateprep.core.parser.ContentParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds empty cache kinds with bundled starter content when enabled, so a fresh
 * deployment without credentials still has something to serve.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheSeedInitializer implements CommandLineRunner {

    private final ContentCache contentCache;
    private final ContentBinder contentBinder;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    @Value("${content.cache.seed.enabled:false}")
    private boolean seedEnabled;

    @Value("${content.cache.seed.resource:classpath:seed/starter-content.json}")
    private String seedResource;

    @Override
    public void run(String... args) {
        if (!seedEnabled) {
            return;
        }

        Resource resource = resourceLoader.getResource(seedResource);
        if (!resource.exists()) {
            log.warn("[SEED] Starter content not found | resource={}", seedResource);
            return;
        }

        try (InputStream in = resource.getInputStream()) {
            List<GeneratedContent> starterContent = readStarterContent(objectMapper.readTree(in));
            int added = contentCache.seedIfEmpty(starterContent);
            log.info("[SEED] Starter content applied | resource={} | available={} | added={}",
                seedResource, starterContent.size(), added);
        } catch (IOException e) {
            log.error("[SEED] Failed to read starter content | resource={} | error={}", seedResource, e.getMessage());
        }
    }

    List<GeneratedContent> readStarterContent(JsonNode root) {
        List<GeneratedContent> entries = new ArrayList<>();
        for (ContentKind kind : ContentKind.values()) {
            JsonNode section = root == null ? null : root.get(kind.getWireKey());
            if (section == null || !section.isArray()) {
                continue;
            }
            for (JsonNode node : section) {
                try {
                    entries.add(contentBinder.bind(node, kind));
                } catch (ContentParseException e) {
                    log.warn("[SEED] Skipping invalid starter entry | kind={} | reason={}", kind.getWireKey(), e.getMessage());
                }
            }
        }
        return entries;
    }
}
