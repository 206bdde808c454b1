package com.gateprep.core.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Outcome of a content request: freshly generated, served from the cache, or
 * nothing available at all.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ContentResult {

    public enum Source {
        GENERATED,
        CACHED,
        UNAVAILABLE
    }

    private static final ContentResult UNAVAILABLE = new ContentResult(Source.UNAVAILABLE, null);

    private final Source source;
    private final GeneratedContent content;

    public static ContentResult generated(GeneratedContent content) {
        return new ContentResult(Source.GENERATED, content);
    }

    public static ContentResult cached(GeneratedContent content) {
        return new ContentResult(Source.CACHED, content);
    }

    public static ContentResult unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return source != Source.UNAVAILABLE;
    }

    public Optional<GeneratedContent> content() {
        return Optional.ofNullable(content);
    }

    @Override
    public String toString() {
        return content == null ? source.name() : source + "(" + content.kind() + ": " + content.naturalKey() + ")";
    }
}
