package com.dcruver.beliefgraph.nlp;

import com.dcruver.beliefgraph.domain.NodePurpose;
import com.dcruver.beliefgraph.domain.Proposition;
import com.dcruver.beliefgraph.domain.SourceType;
import com.dcruver.beliefgraph.exception.ExtractionException;
import com.dcruver.beliefgraph.exception.ProviderException;
import com.dcruver.beliefgraph.support.FakeChatModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing and validating extraction responses.
 */
class LlmExtractionProviderTest {

    private static final String RUN_RESPONSE = """
        {
          "propositions": [
            {
              "proposition": "Completed 5K run at moderate pace",
              "node_purpose": "observation",
              "confidence": 1.0,
              "source_type": "explicit",
              "structured_data": {
                "type": "training_session",
                "distance_meters": 5000,
                "duration_seconds": 2100,
                "pace_per_km_seconds": 414
              }
            },
            {
              "proposition": "Running keeps me sane",
              "node_purpose": "belief",
              "confidence": 0.8,
              "source_type": "inferred",
              "structured_data": null
            }
          ]
        }
        """;

    private LlmExtractionProvider provider(FakeChatModel chatModel) {
        return new LlmExtractionProvider(new OllamaChatService(chatModel), new ObjectMapper());
    }

    @Test
    void testValidResponseParsed() {
        FakeChatModel chatModel = FakeChatModel.replying(RUN_RESPONSE);

        List<Proposition> propositions = provider(chatModel).extract("I ran 5K in 35 minutes at 6:54/km pace");

        assertEquals(2, propositions.size());
        Proposition run = propositions.get(0);
        assertEquals(NodePurpose.OBSERVATION, run.getPurpose());
        assertEquals(SourceType.EXPLICIT, run.getSourceType());
        assertEquals(1.0, run.getConfidence());
        assertEquals(5000, run.getStructuredData().get("distance_meters"));
        assertEquals(2100, run.getStructuredData().get("duration_seconds"));
        assertEquals(414, run.getStructuredData().get("pace_per_km_seconds"));
        assertFalse(propositions.get(1).hasStructuredData());
        assertEquals(SourceType.INFERRED, propositions.get(1).getSourceType());

        // system prompt plus the user's text
        assertEquals(1, chatModel.getPrompts().size());
        assertEquals(2, chatModel.getPrompts().get(0).getInstructions().size());
    }

    @Test
    void testFencedJsonUnwrapped() {
        String fenced = "Here you go:\n```json\n" + RUN_RESPONSE + "```\n";

        assertEquals(2, provider(FakeChatModel.replying(fenced)).extract("text").size());
    }

    @Test
    void testUnknownPurposeCoerced() {
        String response = """
            {"propositions": [{"proposition": "Felt tired after work", "node_purpose": "feeling",
              "confidence": 0.7, "source_type": "explicit"}]}
            """;

        List<Proposition> propositions = provider(FakeChatModel.replying(response)).extract("text");

        assertEquals(NodePurpose.OBSERVATION, propositions.get(0).getPurpose());
        assertNull(propositions.get(0).getStructuredData());
    }

    @Test
    void testInvalidJsonIsExtractionError() {
        assertThrows(ExtractionException.class,
            () -> provider(FakeChatModel.replying("I could not find any propositions.")).extract("text"));
        assertThrows(ExtractionException.class,
            () -> provider(FakeChatModel.replying("{\"propositions\": [")).extract("text"));
    }

    @Test
    void testSchemaViolationsAreExtractionErrors() {
        assertThrows(ExtractionException.class,
            () -> provider(FakeChatModel.replying("{\"items\": []}")).extract("text"));
        assertThrows(ExtractionException.class,
            () -> provider(FakeChatModel.replying("{\"propositions\": {}}")).extract("text"));
        assertThrows(ExtractionException.class, () -> provider(FakeChatModel.replying("""
            {"propositions": [{"node_purpose": "belief", "confidence": 0.5, "source_type": "explicit"}]}
            """)).extract("text"));
        assertThrows(ExtractionException.class, () -> provider(FakeChatModel.replying("""
            {"propositions": [{"proposition": "x", "node_purpose": "belief", "confidence": 1.5,
              "source_type": "explicit"}]}
            """)).extract("text"));
        assertThrows(ExtractionException.class, () -> provider(FakeChatModel.replying("""
            {"propositions": [{"proposition": "  ", "node_purpose": "belief", "confidence": 0.5,
              "source_type": "explicit"}]}
            """)).extract("text"));
    }

    @Test
    void testEmptyPropositionListAllowed() {
        assertTrue(provider(FakeChatModel.replying("{\"propositions\": []}")).extract("ok").isEmpty());
    }

    @Test
    void testModelFailureIsProviderError() {
        FakeChatModel failing = new FakeChatModel(text -> {
            throw new IllegalStateException("connection refused");
        });

        assertThrows(ProviderException.class, () -> provider(failing).extract("text"));
    }

    @Test
    void testBlankTextSkipsModel() {
        FakeChatModel chatModel = FakeChatModel.replying(RUN_RESPONSE);

        assertTrue(provider(chatModel).extract("   ").isEmpty());
        assertTrue(chatModel.getPrompts().isEmpty());
    }
}
