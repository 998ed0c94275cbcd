package com.hvacops.copilot.service.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.model.Citation;
import com.hvacops.copilot.model.ParsedResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts the structured answer from raw model text.
 *
 * <p>The model is asked for a bare JSON object but routinely wraps it in Markdown fences or
 * prose. The parser tries the whole text first, then the first balanced {@code {...}} block
 * that parses as an object. Output without such an object, or without a string
 * {@code answer}, is rejected with {@link ResponseParseException}.</p>
 */
@Component
public class ResponseParser {

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```\\s*$");

    private final ObjectMapper objectMapper;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedResponse parse(String content) {
        if (content == null || content.isBlank()) {
            throw new ResponseParseException("Model returned empty content");
        }
        JsonNode payload = locateObject(stripFences(content.trim()));
        if (payload == null) {
            throw new ResponseParseException("No JSON object found in model output");
        }
        JsonNode answer = payload.get("answer");
        if (answer == null || !answer.isTextual()) {
            throw new ResponseParseException("Model output has no string 'answer' field");
        }
        JsonNode followUps = payload.has("follow_ups") ? payload.get("follow_ups") : payload.get("followUps");
        return new ParsedResponse(answer.asText(), citations(payload.get("citations")), strings(followUps));
    }

    private String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String withoutLeading = LEADING_FENCE.matcher(text).replaceFirst("");
        return TRAILING_FENCE.matcher(withoutLeading).replaceFirst("").trim();
    }

    private JsonNode locateObject(String text) {
        JsonNode whole = readObject(text);
        if (whole != null) {
            return whole;
        }
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = matchingBrace(text, start);
            if (end > start) {
                JsonNode candidate = readObject(text.substring(start, end + 1));
                if (candidate != null) {
                    return candidate;
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    private int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private JsonNode readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private List<Citation> citations(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<Citation> citations = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isObject()) {
                continue;
            }
            citations.add(new Citation(
                    text(item, "doc_id", "docId"),
                    text(item, "date", null),
                    text(item, "type", null),
                    text(item, "snippet", "text"),
                    text(item, "author_name", "authorName"),
                    text(item, "author_email", "authorEmail")
            ));
        }
        return citations;
    }

    private List<String> strings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private String text(JsonNode item, String field, String alternate) {
        JsonNode value = item.get(field);
        if ((value == null || value.isNull()) && alternate != null) {
            value = item.get(alternate);
        }
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
