package com.dcruver.beliefgraph.nlp;

import com.dcruver.beliefgraph.domain.NodePurpose;
import com.dcruver.beliefgraph.domain.Proposition;
import com.dcruver.beliefgraph.domain.SourceType;
import com.dcruver.beliefgraph.exception.ExtractionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Extracts propositions by prompting the chat model for JSON and validating the result.
 */
@Service
@Slf4j
public class LlmExtractionProvider implements ExtractionProvider {

    static final String SYSTEM_PROMPT = """
        You extract atomic observations from a user's message for a personal knowledge graph.
        Respond with valid JSON only, matching the schema below.

        RULES:
        1. Keep the user's own words and voice. Never rewrite into clinical summaries.
        2. Extract leaf-level observations, not abstractions or named patterns.
        3. One claim per proposition: "I ran 5K and felt good" is two propositions.
        4. Each proposition must read on its own: replace pronouns, add the subject.
        5. Skip fragments and meta-commentary such as "let me explain".
        6. Put metrics, dates, quantities and amounts in structured_data; the proposition carries the context.
        7. When the user expresses raw emotion or self-criticism, keep their exact phrases.

        SCHEMA:
        {
          "propositions": [
            {
              "proposition": "string in the user's voice",
              "node_purpose": "observation | belief | pattern | intention | decision",
              "confidence": 0.0-1.0,
              "source_type": "explicit | inferred",
              "structured_data": { "type": "training_session | financial_snapshot | ...", ... } | null
            }
          ]
        }

        node_purpose:
        - observation: factual statement about the world, self, or situation
        - belief: something the user thinks is true
        - pattern: recurring behavior or tendency the user has noticed
        - intention: stated goal or plan
        - decision: choice the user has made

        source_type:
        - explicit: the user said it directly
        - inferred: you derived it from context

        EXAMPLE 1
        User: "I'll spend 3 hours scrolling to avoid a 15-minute task, then hate myself for it"
        {
          "propositions": [
            {
              "proposition": "I'll spend 3 hours scrolling to avoid a 15-minute task, then hate myself for it",
              "node_purpose": "pattern",
              "confidence": 0.95,
              "source_type": "explicit",
              "structured_data": null
            }
          ]
        }

        EXAMPLE 2
        User: "I ran 5K in 35 minutes at 6:54/km pace on January 31, felt controlled"
        {
          "propositions": [
            {
              "proposition": "Completed 5K run at moderate pace, felt controlled",
              "node_purpose": "observation",
              "confidence": 1.0,
              "source_type": "explicit",
              "structured_data": {
                "type": "training_session",
                "activity": "run",
                "distance_meters": 5000,
                "duration_seconds": 2100,
                "pace_per_km_seconds": 414,
                "date": "2025-01-31",
                "subjective_feel": "controlled"
              }
            }
          ]
        }

        EXAMPLE 3
        User: "Portfolio is $139K deployed. This is an awareness problem, not a permission problem."
        {
          "propositions": [
            {
              "proposition": "Current financial state: $139K deployed",
              "node_purpose": "observation",
              "confidence": 1.0,
              "source_type": "explicit",
              "structured_data": { "type": "financial_snapshot", "portfolio_value": 139000 }
            },
            {
              "proposition": "This is an awareness problem, not a permission problem",
              "node_purpose": "belief",
              "confidence": 0.9,
              "source_type": "explicit",
              "structured_data": null
            }
          ]
        }
        """;

    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};

    private final OllamaChatService chatService;
    private final ObjectMapper objectMapper;

    public LlmExtractionProvider(OllamaChatService chatService, ObjectMapper objectMapper) {
        this.chatService = chatService;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Proposition> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String raw = chatService.chat(SYSTEM_PROMPT, text);
        List<Proposition> propositions = parse(raw);
        log.debug("Extracted {} propositions from {} chars", propositions.size(), text.length());
        return propositions;
    }

    /**
     * Validate a model response against the proposition schema.
     *
     * @throws ExtractionException if the response is not JSON or violates the schema
     */
    List<Proposition> parse(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(unwrapJson(raw));
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Model returned invalid JSON: " + preview(raw), e);
        }

        if (root == null || !root.isObject() || !root.has("propositions")) {
            throw new ExtractionException("Response missing 'propositions' key: " + preview(raw));
        }
        JsonNode items = root.get("propositions");
        if (!items.isArray()) {
            throw new ExtractionException("'propositions' must be a list, got " + items.getNodeType());
        }

        List<Proposition> propositions = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            propositions.add(toProposition(i, items.get(i)));
        }
        return propositions;
    }

    private Proposition toProposition(int i, JsonNode item) {
        if (!item.isObject()) {
            throw new ExtractionException("Proposition " + i + " is not an object");
        }

        String text = requireField(i, item, "proposition").asText();
        if (text.isBlank()) {
            throw new ExtractionException("Proposition " + i + " has empty text");
        }

        String purpose = requireField(i, item, "node_purpose").asText();

        JsonNode confidenceNode = requireField(i, item, "confidence");
        if (!confidenceNode.isNumber()) {
            throw new ExtractionException("Proposition " + i + " confidence is not a number: " + confidenceNode);
        }
        double confidence = confidenceNode.asDouble();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new ExtractionException("Proposition " + i + " confidence must be 0.0-1.0, got " + confidence);
        }

        SourceType sourceType;
        try {
            sourceType = SourceType.fromValue(requireField(i, item, "source_type").asText());
        } catch (IllegalArgumentException e) {
            throw new ExtractionException("Proposition " + i + " has invalid source_type", e);
        }

        Map<String, Object> structuredData = null;
        JsonNode structured = item.get("structured_data");
        if (structured != null && !structured.isNull()) {
            if (!structured.isObject()) {
                throw new ExtractionException("Proposition " + i + " structured_data must be an object");
            }
            structuredData = objectMapper.convertValue(structured, JSON_MAP);
        }

        return Proposition.builder()
            .text(text.strip())
            .purpose(NodePurpose.fromValue(purpose))
            .confidence(confidence)
            .sourceType(sourceType)
            .structuredData(structuredData)
            .build();
    }

    private static JsonNode requireField(int i, JsonNode item, String field) {
        JsonNode value = item.get(field);
        if (value == null || value.isNull()) {
            throw new ExtractionException("Proposition " + i + " missing required field: " + field);
        }
        return value;
    }

    /**
     * Strip code fences or prose around the outermost JSON object.
     */
    static String unwrapJson(String raw) {
        if (raw == null) {
            return "";
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end < start) {
            return raw.strip();
        }
        return raw.substring(start, end + 1);
    }

    private static String preview(String raw) {
        if (raw == null) {
            return "<null>";
        }
        return raw.length() <= 200 ? raw : raw.substring(0, 200) + "...";
    }
}
