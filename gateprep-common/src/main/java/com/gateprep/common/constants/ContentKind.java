package com.gateprep.common.constants;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of study content the bot can generate. The wire key is used in prompts,
 * in the cache file and in request paths.
 */
@Getter
@RequiredArgsConstructor
public enum ContentKind {

    QUESTION("question", "GATE multiple-choice question"),
    FACT("fact", "Key note / one-liner"),
    FORMULA("formula", "Formula card"),
    LANGUAGE("language", "Language micro-lesson");

    private final String wireKey;
    private final String displayName;

    public static ContentKind fromString(String value) {
        if (value != null) {
            for (ContentKind kind : values()) {
                if (kind.name().equalsIgnoreCase(value.trim()) || kind.wireKey.equalsIgnoreCase(value.trim())) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown content kind: " + value);
    }
}
