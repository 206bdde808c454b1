package com.gateprep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gateprep.common.constants.ContentKind;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LanguageTipContent(
    @JsonProperty("language") String language,
    @JsonProperty("word") String word,
    @JsonProperty("phonetic") String phonetic,
    @JsonProperty("meaning") String meaning,
    @JsonProperty("usage") String usage,
    @JsonProperty("tip") String tip
) implements GeneratedContent {

    @Override
    public ContentKind kind() {
        return ContentKind.LANGUAGE;
    }

    @Override
    public String naturalKey() {
        return word;
    }
}
