package com.gateprep.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateprep.common.constants.ContentKind;
import com.gateprep.core.model.FactContent;
import com.gateprep.core.model.FormulaContent;
import com.gateprep.core.model.GeneratedContent;
import com.gateprep.core.model.LanguageTipContent;
import com.gateprep.core.model.QuestionContent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds a JSON object to the content record for a kind, enforcing the kind's
 * required fields. Shared by response parsing and cache loading.
 */
@Component
public class ContentBinder {

    public GeneratedContent bind(JsonNode node, ContentKind kind) throws ContentParseException {
        if (node == null || !node.isObject()) {
            throw new ContentParseException("Expected a JSON object for " + kind.getWireKey());
        }
        return switch (kind) {
            case QUESTION -> bindQuestion(node);
            case FACT -> new FactContent(
                required(node, "fact"),
                optional(node, "topic"),
                optional(node, "source"),
                optional(node, "visual_hint"));
            case FORMULA -> new FormulaContent(
                required(node, "title"),
                required(node, "formula"),
                required(node, "explanation"),
                optional(node, "topic"),
                optional(node, "source"),
                optional(node, "visual_hint"));
            case LANGUAGE -> new LanguageTipContent(
                required(node, "language"),
                required(node, "word"),
                required(node, "phonetic"),
                required(node, "meaning"),
                required(node, "usage"),
                required(node, "tip"));
        };
    }

    private QuestionContent bindQuestion(JsonNode node) throws ContentParseException {
        String text = required(node, "question");

        JsonNode optionsNode = node.get("options");
        if (optionsNode == null || !optionsNode.isArray() || optionsNode.size() != QuestionContent.OPTION_COUNT) {
            throw new ContentParseException("Field 'options' must be an array of exactly "
                + QuestionContent.OPTION_COUNT + " strings");
        }
        List<String> options = new ArrayList<>(QuestionContent.OPTION_COUNT);
        for (JsonNode option : optionsNode) {
            if (!option.isTextual()) {
                throw new ContentParseException("Field 'options' must contain only strings");
            }
            options.add(option.asText());
        }

        JsonNode correct = node.get("correct_option_id");
        if (correct == null || !correct.canConvertToInt() || !correct.isIntegralNumber()) {
            throw new ContentParseException("Field 'correct_option_id' must be an integer");
        }
        int correctIndex = correct.intValue();
        if (correctIndex < 0 || correctIndex >= QuestionContent.OPTION_COUNT) {
            throw new ContentParseException("Field 'correct_option_id' out of range: " + correctIndex);
        }

        return new QuestionContent(
            text,
            options,
            correctIndex,
            required(node, "explanation"),
            optional(node, "topic"),
            optional(node, "difficulty"),
            optional(node, "source"),
            optional(node, "visual_hint"));
    }

    private static String required(JsonNode node, String field) throws ContentParseException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ContentParseException("Missing or blank field '" + field + "'");
        }
        return value.asText();
    }

    // wrong shapes are dropped, not rejected
    private static String optional(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
