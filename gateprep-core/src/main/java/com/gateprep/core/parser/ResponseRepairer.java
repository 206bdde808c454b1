package com.gateprep.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateprep.common.constants.ContentKind;
import com.gateprep.core.model.GeneratedContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Turns loosely formatted model output into validated content.
 *
 * <p>Models often wrap JSON in markdown fences, add chatter around it, or stop
 * one brace short. Repair strips fences, closes a single missing trailing
 * brace and cuts the text to the outermost object before binding.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseRepairer {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json|JSON)?");

    private final ObjectMapper objectMapper;
    private final ContentBinder contentBinder;

    public GeneratedContent repairAndParse(String rawText, ContentKind kind) throws ContentParseException {
        if (rawText == null || rawText.isBlank()) {
            throw new ContentParseException("Empty response");
        }

        String unfenced = CODE_FENCE.matcher(rawText).replaceAll("").trim();
        String repaired = outermostObject(closeTrailingBrace(unfenced));
        if (repaired == null) {
            log.warn("[REPAIR] No JSON object found | kind={} | rawLength={}", kind.getWireKey(), rawText.length());
            throw new ContentParseException("No JSON object found in response");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(repaired);
        } catch (JsonProcessingException e) {
            // a complete object followed by chatter must not be "closed" again
            String unclosed = outermostObject(unfenced);
            node = unclosed == null || unclosed.equals(repaired) ? null : tryRead(unclosed);
            if (node == null) {
                log.warn("[REPAIR] Unparseable JSON | kind={} | error={}", kind.getWireKey(), e.getOriginalMessage());
                throw new ContentParseException("Invalid JSON: " + e.getOriginalMessage(), e);
            }
        }

        try {
            GeneratedContent content = contentBinder.bind(node, kind);
            log.debug("[REPAIR] Parsed content | kind={} | key={}", kind.getWireKey(), content.naturalKey());
            return content;
        } catch (ContentParseException e) {
            log.warn("[REPAIR] Content failed validation | kind={} | reason={}", kind.getWireKey(), e.getMessage());
            throw e;
        }
    }

    static String closeTrailingBrace(String text) {
        return text.startsWith("{") && !text.endsWith("}") ? text + "}" : text;
    }

    /**
     * Slice from the first opening brace to the last closing one, or {@code null}
     * when there is no such region.
     */
    static String outermostObject(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }

    private JsonNode tryRead(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
