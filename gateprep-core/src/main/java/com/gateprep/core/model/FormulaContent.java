package com.gateprep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gateprep.common.constants.ContentKind;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormulaContent(
    @JsonProperty("title") String title,
    @JsonProperty("formula") String formula,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("topic") String topic,
    @JsonProperty("source") String source,
    @JsonProperty("visual_hint") String visualHint
) implements GeneratedContent {

    @Override
    public ContentKind kind() {
        return ContentKind.FORMULA;
    }

    @Override
    public String naturalKey() {
        return title;
    }
}
