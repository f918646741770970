package com.archivist.taxonomy.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class JsonObjectExtractor {

    private final ObjectMapper objectMapper;

    public JsonObjectExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<ObjectNode> firstObject(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        int start = text.indexOf('{');
        while (start >= 0) {
            int end = matchingBrace(text, start);
            if (end > start) {
                Optional<ObjectNode> parsed = tryParse(text.substring(start, end + 1));
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private Optional<ObjectNode> tryParse(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node instanceof ObjectNode object ? Optional.of(object) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    static int matchingBrace(String text, int open) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = open; i < text.length(); i++) {
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
}
