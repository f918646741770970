package com.archivist.taxonomy.service;

import com.archivist.taxonomy.model.TriageStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads a triage verdict out of model output. Never throws: anything unusable
 * becomes a {@link ParseError} carrying a reason fit for the document row.
 */
@Component
public class TriageResponseParser {

    private static final int MAX_REASON_LENGTH = 1000;

    private final JsonObjectExtractor extractor;

    public TriageResponseParser(JsonObjectExtractor extractor) {
        this.extractor = extractor;
    }

    public sealed interface Result permits ParsedTriage, ParseError {}

    public record ParsedTriage(TriageStatus status, double confidence, String reason) implements Result {}

    public record ParseError(String message) implements Result {}

    public Result parse(String content) {
        if (content == null || content.isBlank()) {
            return new ParseError("Empty model response");
        }

        Optional<ObjectNode> json = extractor.firstObject(content);
        if (json.isEmpty()) {
            return new ParseError("No JSON object in model response: " + abbreviate(content, 200));
        }

        ObjectNode node = json.get();
        String label = text(node, "status");
        if (label == null) {
            label = text(node, "category");
        }
        if (label == null) {
            return new ParseError("Model response has no status field");
        }

        Optional<TriageStatus> status = TriageStatus.fromLabel(label);
        if (status.isEmpty()) {
            return new ParseError("Unknown triage status '" + abbreviate(label, 50) + "'");
        }

        String reason = text(node, "reason");
        return new ParsedTriage(status.get(), confidence(node.get("confidence")),
            reason == null ? null : abbreviate(reason, MAX_REASON_LENGTH));
    }

    // Percentages are scaled down; missing or non-numeric values count as zero.
    static double confidence(JsonNode node) {
        double value;
        if (node == null || node.isNull()) {
            return 0.0;
        } else if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim().replace("%", ""));
            } catch (NumberFormatException e) {
                return 0.0;
            }
        } else {
            return 0.0;
        }

        if (Double.isNaN(value)) {
            return 0.0;
        }
        if (value > 1.0 && value <= 100.0) {
            value = value / 100.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String text(ObjectNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    static String abbreviate(String value, int max) {
        String flat = value.strip();
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }
}
