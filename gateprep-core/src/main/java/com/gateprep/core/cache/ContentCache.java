package com.gateprep.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gateprep.common.constants.ContentKind;
import com.gateprep.common.util.FileUtils;
import com.gateprep.core.model.GeneratedContent;
import com.gateprep.core.parser.ContentBinder;
import com.gateprep.core.parser.ContentParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File-backed store of previously generated content, used as the fallback when
 * no provider can produce something new.
 *
 * <p>Every operation reloads the whole file. Writes are read-modify-write under
 * an exclusive lock: a JVM-wide lock per file (so several instances pointing at
 * the same path cooperate) plus an OS lock on a sidecar {@code .lock} file for
 * other processes. The file is replaced atomically, so unlocked readers only
 * ever see a complete document.</p>
 */
@Service
@Slf4j
public class ContentCache {

    private static final Map<Path, ReentrantLock> PATH_LOCKS = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final ContentBinder contentBinder;
    private final Path cacheFile;
    private final Path lockFile;
    private final int maxEntriesPerKind;

    public ContentCache(
        ObjectMapper objectMapper,
        ContentBinder contentBinder,
        @Value("${content.cache.file:./content_cache.json}") String cacheFile,
        @Value("${content.cache.max-entries-per-kind:100}") int maxEntriesPerKind
    ) {
        if (maxEntriesPerKind < 1) {
            throw new IllegalArgumentException("content.cache.max-entries-per-kind must be positive");
        }
        this.objectMapper = objectMapper;
        this.contentBinder = contentBinder;
        this.cacheFile = Paths.get(cacheFile).toAbsolutePath().normalize();
        this.lockFile = FileUtils.siblingWithSuffix(this.cacheFile, ".lock");
        this.maxEntriesPerKind = maxEntriesPerKind;

        log.info("[CACHE] Content cache initialized | file={} | maxEntriesPerKind={}",
            this.cacheFile, maxEntriesPerKind);
    }

    public int getMaxEntriesPerKind() {
        return maxEntriesPerKind;
    }

    /**
     * Reads the cache file. A missing, unreadable or corrupt file yields an empty
     * store; entries that do not bind are skipped.
     */
    public CacheStore load() {
        CacheStore store = new CacheStore();
        if (!Files.exists(cacheFile)) {
            log.debug("[CACHE] No cache file yet | file={}", cacheFile);
            return store;
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(cacheFile.toFile());
        } catch (IOException e) {
            log.warn("[CACHE] Cache file unreadable, treating as empty | file={} | error={}",
                cacheFile, e.getMessage());
            return store;
        }

        if (root == null || !root.isObject()) {
            log.warn("[CACHE] Cache file is not a JSON object, treating as empty | file={}", cacheFile);
            return store;
        }

        int skipped = 0;
        for (ContentKind kind : ContentKind.values()) {
            JsonNode entries = root.get(kind.getWireKey());
            if (entries == null || entries.isNull()) {
                continue;
            }
            if (!entries.isArray()) {
                log.warn("[CACHE] Ignoring non-array section | kind={}", kind.getWireKey());
                continue;
            }
            for (JsonNode entry : entries) {
                try {
                    store.restore(contentBinder.bind(entry, kind));
                } catch (ContentParseException e) {
                    skipped++;
                    log.warn("[CACHE] Skipping malformed entry | kind={} | reason={}", kind.getWireKey(), e.getMessage());
                }
            }
        }

        log.debug("[CACHE] Loaded cache | sizes={} | skipped={}", store.sizes(), skipped);
        return store;
    }

    /**
     * Adds content unless an entry with the same natural key is already cached.
     * I/O failures are logged and reported as {@code false}.
     */
    public boolean add(GeneratedContent content) {
        return addAll(List.of(content)) == 1;
    }

    /**
     * Adds the given entries to kinds that currently hold nothing. Used to seed a
     * fresh deployment with starter content.
     *
     * @return number of entries added
     */
    public int seedIfEmpty(Collection<? extends GeneratedContent> starterContent) {
        return mutate(store -> {
            Map<ContentKind, Integer> before = store.sizes();
            int added = 0;
            for (GeneratedContent content : starterContent) {
                if (before.get(content.kind()) == 0 && store.append(content, maxEntriesPerKind)) {
                    added++;
                }
            }
            return added;
        }, "seed");
    }

    private int addAll(Collection<? extends GeneratedContent> contents) {
        return mutate(store -> {
            int added = 0;
            for (GeneratedContent content : contents) {
                if (store.append(content, maxEntriesPerKind)) {
                    added++;
                } else {
                    log.debug("[CACHE] Duplicate skipped | kind={} | key={}",
                        content.kind().getWireKey(), content.naturalKey());
                }
            }
            return added;
        }, "add");
    }

    private int mutate(StoreMutation mutation, String operation) {
        ReentrantLock lock = PATH_LOCKS.computeIfAbsent(cacheFile, p -> new ReentrantLock());
        lock.lock();
        try {
            FileUtils.ensureParentDirectory(lockFile);
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                CacheStore store = load();
                int changed = mutation.apply(store);
                if (changed > 0) {
                    FileUtils.writeAtomically(cacheFile, serialize(store));
                    log.info("[CACHE] Cache updated | operation={} | added={} | sizes={}", operation, changed, store.sizes());
                }
                return changed;
            }
        } catch (IOException | RuntimeException e) {
            log.error("[CACHE] Failed to update cache | operation={} | file={} | error={}",
                operation, cacheFile, e.getMessage(), e);
            return 0;
        } finally {
            lock.unlock();
        }
    }

    private byte[] serialize(CacheStore store) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        for (ContentKind kind : ContentKind.values()) {
            ArrayNode array = root.putArray(kind.getWireKey());
            for (GeneratedContent content : store.entries(kind)) {
                array.add(objectMapper.valueToTree(content));
            }
        }
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
    }

    /**
     * A uniformly random cached entry of the given kind, if any.
     */
    public Optional<GeneratedContent> sample(ContentKind kind) {
        List<GeneratedContent> entries = load().entries(kind);
        if (entries.isEmpty()) {
            log.debug("[CACHE] Nothing cached | kind={}", kind.getWireKey());
            return Optional.empty();
        }
        GeneratedContent picked = entries.get(ThreadLocalRandom.current().nextInt(entries.size()));
        log.debug("[CACHE] Sampled cached entry | kind={} | poolSize={}", kind.getWireKey(), entries.size());
        return Optional.of(picked);
    }

    public int size(ContentKind kind) {
        return load().size(kind);
    }

    public Map<ContentKind, Integer> sizes() {
        return load().sizes();
    }

    @FunctionalInterface
    private interface StoreMutation {
        int apply(CacheStore store);
    }
}
