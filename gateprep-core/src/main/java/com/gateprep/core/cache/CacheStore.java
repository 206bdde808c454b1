package com.gateprep.core.cache;

import com.gateprep.common.constants.ContentKind;
import com.gateprep.core.model.GeneratedContent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory image of the cache file: per kind, entries oldest first.
 * Not thread-safe; every access works on a freshly loaded copy.
 */
public class CacheStore {

    private final Map<ContentKind, List<GeneratedContent>> entries = new EnumMap<>(ContentKind.class);

    public CacheStore() {
        for (ContentKind kind : ContentKind.values()) {
            entries.put(kind, new ArrayList<>());
        }
    }

    public List<GeneratedContent> entries(ContentKind kind) {
        return Collections.unmodifiableList(entries.get(kind));
    }

    public boolean contains(ContentKind kind, String naturalKey) {
        return entries.get(kind).stream().anyMatch(e -> e.naturalKey().equals(naturalKey));
    }

    /**
     * Appends unless an entry with the same natural key exists, then drops the
     * oldest entries beyond {@code maxEntries}.
     *
     * @return whether the content was appended
     */
    public boolean append(GeneratedContent content, int maxEntries) {
        if (contains(content.kind(), content.naturalKey())) {
            return false;
        }
        List<GeneratedContent> list = entries.get(content.kind());
        list.add(content);
        while (list.size() > maxEntries) {
            list.remove(0);
        }
        return true;
    }

    // load path only: keeps file order, no cap
    void restore(GeneratedContent content) {
        if (!contains(content.kind(), content.naturalKey())) {
            entries.get(content.kind()).add(content);
        }
    }

    public int size(ContentKind kind) {
        return entries.get(kind).size();
    }

    public Map<ContentKind, Integer> sizes() {
        Map<ContentKind, Integer> sizes = new LinkedHashMap<>();
        entries.forEach((kind, list) -> sizes.put(kind, list.size()));
        return sizes;
    }

    public boolean isEmpty() {
        return entries.values().stream().allMatch(List::isEmpty);
    }
}
