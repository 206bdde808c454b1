package com.gateprep.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gateprep.core.model.ContentResult;
import com.gateprep.core.model.GeneratedContent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentResponse {
    private String kind;
    private String source; // "generated" or "cached"
    private String topic;
    private GeneratedContent content;

    public static ContentResponse from(ContentResult result, String topicDisplayName) {
        GeneratedContent content = result.getContent();
        return ContentResponse.builder()
            .kind(content.kind().getWireKey())
            .source(result.getSource().name().toLowerCase())
            .topic(topicDisplayName)
            .content(content)
            .build();
    }
}
