package com.gateprep.core.service;

import com.gateprep.common.model.ContentRequest;
import com.gateprep.core.cache.ContentCache;
import com.gateprep.core.model.ContentResult;
import com.gateprep.core.model.GeneratedContent;
import com.gateprep.core.parser.ResponseRepairer;
import com.gateprep.llm.prompt.ContentPromptBuilder;
import com.gateprep.llm.router.FailoverLlmRouter;
import com.gateprep.llm.router.FailoverLlmRouter.LlmRouterException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Single entry point for content. Tries to generate something new through the
 * provider chain, caches whatever succeeds, and falls back to a random cached
 * entry when generation is impossible.
 */
@Service
@Slf4j
public class ContentService {

    private final FailoverLlmRouter llmRouter;
    private final ContentPromptBuilder promptBuilder;
    private final ResponseRepairer responseRepairer;
    private final ContentCache contentCache;
    private final ExecutorService executorService;

    public ContentService(
        FailoverLlmRouter llmRouter,
        ContentPromptBuilder promptBuilder,
        ResponseRepairer responseRepairer,
        ContentCache contentCache,
        @Value("${content.service.worker-threads:8}") int workerThreads
    ) {
        this.llmRouter = llmRouter;
        this.promptBuilder = promptBuilder;
        this.responseRepairer = responseRepairer;
        this.contentCache = contentCache;
        this.executorService = Executors.newFixedThreadPool(Math.max(1, workerThreads));
    }

    public ContentResult getContent(ContentRequest request) {
        long startTime = System.currentTimeMillis();
        String kind = request.getKind().getWireKey();

        log.info("[CONTENT] Content requested | kind={} | topic={} | difficulty={}",
            kind, request.getTopicDisplayName(), request.getDifficulty());

        if (!llmRouter.hasConfiguredProviders()) {
            log.info("[CONTENT] No provider configured, serving from cache | kind={}", kind);
            return fromCache(request, startTime);
        }

        String prompt = promptBuilder.build(request);
        try {
            GeneratedContent content = llmRouter.generateContent(prompt,
                rawText -> responseRepairer.repairAndParse(rawText, request.getKind()));

            boolean added = contentCache.add(content);
            log.info("[CONTENT] Generated new content | kind={} | cached={} | durationMs={}",
                kind, added, System.currentTimeMillis() - startTime);
            return ContentResult.generated(content);
        } catch (LlmRouterException e) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("[CONTENT] Request cancelled | kind={} | durationMs={}", kind, System.currentTimeMillis() - startTime);
                return ContentResult.unavailable();
            }
            log.warn("[CONTENT] Generation failed, falling back to cache | kind={} | attemptedProviders={} | error={}",
                kind, e.getAttemptedProviders(), e.getMessage());
            return fromCache(request, startTime);
        }
    }

    /**
     * Runs {@link #getContent} on the worker pool. Cancelling the returned future
     * interrupts the run, which stops backoff waits and in-flight provider calls.
     */
    public CompletableFuture<ContentResult> getContentAsync(ContentRequest request) {
        CompletableFuture<ContentResult> future = new CompletableFuture<>();
        Future<?> task = executorService.submit(() -> {
            try {
                future.complete(getContent(request));
            } catch (RuntimeException e) {
                log.error("[CONTENT] Unexpected failure | kind={} | error={}",
                    request.getKind().getWireKey(), e.getMessage(), e);
                future.completeExceptionally(e);
            }
        });
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                task.cancel(true);
            }
        });
        return future;
    }

    private ContentResult fromCache(ContentRequest request, long startTime) {
        Optional<GeneratedContent> cached = contentCache.sample(request.getKind());
        if (cached.isPresent()) {
            log.info("[CONTENT] Served cached content | kind={} | durationMs={}",
                request.getKind().getWireKey(), System.currentTimeMillis() - startTime);
            return ContentResult.cached(cached.get());
        }
        log.warn("[CONTENT] Nothing available | kind={} | durationMs={}",
            request.getKind().getWireKey(), System.currentTimeMillis() - startTime);
        return ContentResult.unavailable();
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[CONTENT] Worker pool did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
