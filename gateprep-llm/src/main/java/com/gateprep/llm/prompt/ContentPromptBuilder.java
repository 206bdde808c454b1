package com.gateprep.llm.prompt;

import com.gateprep.common.constants.Difficulty;
import com.gateprep.common.constants.TopicCode;
import com.gateprep.common.model.ContentRequest;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps a {@link ContentRequest} to provider-agnostic prompt text. Pure: the same
 * request always yields the same prompt.
 */
@Component
public class ContentPromptBuilder {

    private static final String ALL_TOPIC_NAMES = Arrays.stream(TopicCode.values())
        .map(TopicCode::getDisplayName)
        .collect(Collectors.joining(", "));

    private static final String ALL_TOPIC_CODES = Arrays.stream(TopicCode.values())
        .map(TopicCode::name)
        .collect(Collectors.joining(", "));

    public String build(ContentRequest request) {
        Optional<TopicCode> topic = request.getTopic();
        String topicLine = topicLine(topic);
        String topicValue = topic.map(TopicCode::name).orElse("One of: " + ALL_TOPIC_CODES);

        String body;
        switch (request.getKind()) {
            case QUESTION:
                Difficulty difficulty = request.getDifficulty();
                body = String.format(ContentPrompts.QUESTION_TEMPLATE,
                    topicLine,
                    difficulty.getWireValue(),
                    guidanceFor(difficulty),
                    topicValue,
                    difficulty.getWireValue());
                break;
            case FACT:
                body = String.format(ContentPrompts.FACT_TEMPLATE, topicLine, topicValue);
                break;
            case FORMULA:
                body = String.format(ContentPrompts.FORMULA_TEMPLATE, topicLine, topicValue);
                break;
            case LANGUAGE:
                body = String.format(ContentPrompts.LANGUAGE_TEMPLATE, ContentPrompts.LANGUAGES);
                break;
            default:
                throw new IllegalArgumentException("Unsupported content kind: " + request.getKind());
        }
        return body + ContentPrompts.JSON_ONLY_FOOTER;
    }

    private static String topicLine(Optional<TopicCode> topic) {
        return topic
            .map(t -> String.format(ContentPrompts.SPECIFIC_TOPIC_TEMPLATE, t.getDisplayName(), t.name()))
            .orElse(String.format(ContentPrompts.ANY_TOPIC_TEMPLATE, ALL_TOPIC_NAMES, ALL_TOPIC_CODES));
    }

    private static String guidanceFor(Difficulty difficulty) {
        switch (difficulty) {
            case EASY:
                return ContentPrompts.EASY_GUIDANCE;
            case HARD:
                return ContentPrompts.HARD_GUIDANCE;
            case MEDIUM:
            default:
                return ContentPrompts.MEDIUM_GUIDANCE;
        }
    }
}
