package com.gateprep.common.model;

import com.gateprep.common.constants.ContentKind;
import com.gateprep.common.constants.Difficulty;
import com.gateprep.common.constants.TopicCode;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * An abstract content request, e.g. "a hard question on Soil Mechanics".
 * Difficulty only applies to questions and is dropped for every other kind.
 */
@Value
public class ContentRequest {

    ContentKind kind;
    String topicCode;
    Difficulty difficulty;

    @Builder
    private ContentRequest(ContentKind kind, String topicCode, Difficulty difficulty) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.topicCode = topicCode == null || topicCode.isBlank() ? null : topicCode.trim().toUpperCase(Locale.ROOT);
        if (kind == ContentKind.QUESTION) {
            this.difficulty = difficulty != null ? difficulty : Difficulty.MEDIUM;
        } else {
            this.difficulty = null;
        }
    }

    public static ContentRequest of(ContentKind kind) {
        return builder().kind(kind).build();
    }

    public static ContentRequest question(String topicCode, Difficulty difficulty) {
        return builder().kind(ContentKind.QUESTION).topicCode(topicCode).difficulty(difficulty).build();
    }

    public Optional<TopicCode> getTopic() {
        return TopicCode.fromCode(topicCode);
    }

    public String getTopicDisplayName() {
        return TopicCode.displayNameOf(topicCode);
    }
}
