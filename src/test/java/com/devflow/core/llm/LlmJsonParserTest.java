package com.devflow.core.llm;

import com.devflow.core.model.RiskAssessment;
import com.devflow.core.model.RiskLevel;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link LlmJsonParser}.
 */
class LlmJsonParserTest {

    private final LlmJsonParser parser = new LlmJsonParser();

    @Test
    @DisplayName("reads a bare JSON object")
    void bareJson() {
        Optional<JsonNode> node = parser.readObject("{\"action\":\"commit\"}");

        assertEquals("commit", node.orElseThrow().get("action").asText());
    }

    @Test
    @DisplayName("strips markdown code fences")
    void fencedJson() {
        Optional<JsonNode> node = parser.readObject("```json\n{\"action\":\"wait\"}\n```");

        assertEquals("wait", node.orElseThrow().get("action").asText());
    }

    @Test
    @DisplayName("falls back to the outermost braces inside prose")
    void embeddedJson() {
        Optional<JsonNode> node = parser.readObject(
                "Sure! Here is my decision: {\"action\":\"pr\",\"meta\":{\"x\":1}} Let me know.");

        assertEquals("pr", node.orElseThrow().get("action").asText());
    }

    @Test
    @DisplayName("text without an object yields empty")
    void noJson() {
        assertTrue(parser.readObject("I would commit now.").isEmpty());
        assertTrue(parser.readObject("[1, 2, 3]").isEmpty());
        assertTrue(parser.readObject(null).isEmpty());
    }

    @Test
    @DisplayName("converts a node into a record, ignoring unknown fields")
    void convertsRecord() {
        JsonNode node = parser.readObject(
                "{\"score\":0.4,\"factors\":[\"protected branch\"],\"level\":\"medium\",\"requiresApproval\":true,\"extra\":1}")
                .orElseThrow();

        RiskAssessment risk = parser.convert(node, RiskAssessment.class);

        assertEquals(0.4, risk.score());
        assertEquals(List.of("protected branch"), risk.factors());
        assertEquals(RiskLevel.MEDIUM, risk.level());
        assertTrue(risk.requiresApproval());
    }

    @Test
    @DisplayName("conversion failure is reported as a parse exception")
    void conversionFailure() {
        JsonNode node = parser.readObject("{\"score\":\"high\",\"level\":\"medium\"}").orElseThrow();

        assertThrows(LlmParseException.class, () -> parser.convert(node, RiskAssessment.class));
    }
}
