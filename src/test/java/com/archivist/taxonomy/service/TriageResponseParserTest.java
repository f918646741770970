package com.archivist.taxonomy.service;

import com.archivist.taxonomy.model.TriageStatus;
import com.archivist.taxonomy.service.TriageResponseParser.ParseError;
import com.archivist.taxonomy.service.TriageResponseParser.ParsedTriage;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TriageResponseParserTest {

    private final TriageResponseParser parser = new TriageResponseParser(new JsonObjectExtractor(new ObjectMapper()));

    @Test
    @DisplayName("Fenced JSON surrounded by prose parses to CourtDoc with confidence 0.9")
    void shouldParseFencedJsonWithProse() {
        String content = """
            Here is my classification of the document:

            ```json
            {"status":"CourtDoc","confidence":0.9,"reason":"Judgment issued by a tribunal"}
            ```

            Let me know if you need anything else.
            """;

        TriageResponseParser.Result result = parser.parse(content);

        assertThat(result).isInstanceOf(ParsedTriage.class);
        ParsedTriage triage = (ParsedTriage) result;
        assertThat(triage.status()).isEqualTo(TriageStatus.COURT_DOC);
        assertThat(triage.confidence()).isEqualTo(0.9);
        assertThat(triage.reason()).isEqualTo("Judgment issued by a tribunal");
    }

    @Test
    @DisplayName("Braces inside prose before the object do not hide it")
    void shouldSkipUnparseableBraces() {
        String content = "Template {placeholder} ignored. {\"status\": \"FirmDrafted\", \"confidence\": 0.75}";

        ParsedTriage triage = (ParsedTriage) parser.parse(content);

        assertThat(triage.status()).isEqualTo(TriageStatus.FIRM_DRAFTED);
        assertThat(triage.confidence()).isEqualTo(0.75);
        assertThat(triage.reason()).isNull();
    }

    @Test
    @DisplayName("Category field and snake case labels are accepted")
    void shouldAcceptCategoryFieldAndLooseLabels() {
        ParsedTriage triage = (ParsedTriage) parser.parse("{\"category\": \"third_party\", \"confidence\": \"80%\"}");

        assertThat(triage.status()).isEqualTo(TriageStatus.THIRD_PARTY);
        assertThat(triage.confidence()).isCloseTo(0.8, within(1e-9));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"I cannot classify this document.", "{\"confidence\": 0.4}", "{\"status\": \"Spam\"}", "{\"status\": "})
    @DisplayName("Unusable responses become parse errors instead of exceptions")
    void shouldReturnParseError(String content) {
        TriageResponseParser.Result result = parser.parse(content);

        assertThat(result).isInstanceOf(ParseError.class);
        assertThat(((ParseError) result).message()).isNotBlank();
    }

    @Test
    void shouldNormalizeConfidence() {
        JsonNodeFactory nodes = JsonNodeFactory.instance;

        assertThat(TriageResponseParser.confidence(nodes.numberNode(85))).isCloseTo(0.85, within(1e-9));
        assertThat(TriageResponseParser.confidence(nodes.numberNode(250))).isEqualTo(1.0);
        assertThat(TriageResponseParser.confidence(nodes.numberNode(-3))).isEqualTo(0.0);
        assertThat(TriageResponseParser.confidence(nodes.textNode("high"))).isEqualTo(0.0);
        assertThat(TriageResponseParser.confidence(null)).isEqualTo(0.0);
    }

    @Test
    void shouldCapLongReasons() {
        String reason = "x".repeat(5000);

        ParsedTriage triage = (ParsedTriage) parser.parse("{\"status\": \"Irrelevant\", \"reason\": \"" + reason + "\"}");

        assertThat(triage.reason()).hasSize(1003).endsWith("...");
    }
}
