package com.gateprep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gateprep.common.constants.ContentKind;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuestionContent(
    @JsonProperty("question") String text,
    @JsonProperty("options") List<String> options,
    @JsonProperty("correct_option_id") int correctOptionIndex,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("topic") String topic,
    @JsonProperty("difficulty") String difficulty,
    @JsonProperty("source") String source,
    @JsonProperty("visual_hint") String visualHint
) implements GeneratedContent {

    public static final int OPTION_COUNT = 4;

    public QuestionContent {
        options = options == null ? List.of() : List.copyOf(options);
    }

    @Override
    public ContentKind kind() {
        return ContentKind.QUESTION;
    }

    @Override
    public String naturalKey() {
        return text;
    }

    public String correctOption() {
        return options.get(correctOptionIndex);
    }
}
