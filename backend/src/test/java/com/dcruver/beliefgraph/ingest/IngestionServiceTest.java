package com.dcruver.beliefgraph.ingest;

import com.dcruver.beliefgraph.config.IngestionProperties;
import com.dcruver.beliefgraph.domain.BeliefDetails;
import com.dcruver.beliefgraph.domain.Edge;
import com.dcruver.beliefgraph.domain.EdgeProperties;
import com.dcruver.beliefgraph.domain.EdgeType;
import com.dcruver.beliefgraph.domain.EmbeddingType;
import com.dcruver.beliefgraph.domain.Node;
import com.dcruver.beliefgraph.domain.NodePurpose;
import com.dcruver.beliefgraph.domain.NodeSource;
import com.dcruver.beliefgraph.domain.NodeVariant;
import com.dcruver.beliefgraph.domain.Proposition;
import com.dcruver.beliefgraph.domain.RelatedNode;
import com.dcruver.beliefgraph.domain.SourceType;
import com.dcruver.beliefgraph.exception.ErrorKind;
import com.dcruver.beliefgraph.exception.ExtractionException;
import com.dcruver.beliefgraph.exception.ProviderException;
import com.dcruver.beliefgraph.exception.StorageException;
import com.dcruver.beliefgraph.exception.ValidationException;
import com.dcruver.beliefgraph.graph.GraphStore;
import com.dcruver.beliefgraph.graph.SqliteGraphStore;
import com.dcruver.beliefgraph.io.ConversationMessage;
import com.dcruver.beliefgraph.io.ConversationParser;
import com.dcruver.beliefgraph.io.MessageRole;
import com.dcruver.beliefgraph.nlp.ExtractionProvider;
import com.dcruver.beliefgraph.nlp.LlmExtractionProvider;
import com.dcruver.beliefgraph.nlp.OllamaChatService;
import com.dcruver.beliefgraph.support.FakeChatModel;
import com.dcruver.beliefgraph.support.FakeEmbeddingProvider;
import com.dcruver.beliefgraph.support.TestStores;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the extract, embed, dedup, store and link pipeline against a real SQLite store.
 */
class IngestionServiceTest {

    private static final int DIMS = 8;

    @TempDir
    Path tempDir;

    private TestStores stores;
    private FakeEmbeddingProvider embeddings;
    private IngestionProperties properties;
    private final List<IngestionService> services = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        stores = TestStores.open(tempDir.resolve("graph.db"), DIMS);
        embeddings = new FakeEmbeddingProvider(DIMS);
        properties = new IngestionProperties();
    }

    @AfterEach
    void tearDown() {
        services.forEach(IngestionService::shutdown);
    }

    private IngestionService service(ExtractionProvider extractor) {
        return service(extractor, stores.graphStore);
    }

    private IngestionService service(ExtractionProvider extractor, GraphStore graphStore) {
        IngestionService service = new IngestionService(extractor, embeddings, graphStore,
            stores.embeddingStore, new ConversationParser(), properties,
            stores.transactionManager);
        services.add(service);
        return service;
    }

    private static Proposition proposition(String text) {
        return Proposition.builder()
            .text(text)
            .purpose(NodePurpose.OBSERVATION)
            .confidence(0.9)
            .sourceType(SourceType.EXPLICIT)
            .build();
    }

    // one proposition per message, equal to the message text
    private static final ExtractionProvider ECHO = text -> List.of(proposition(text));

    private static ConversationMessage userMessage(int index, String text, String sessionId) {
        return ConversationMessage.builder()
            .text(text)
            .role(MessageRole.USER)
            .sessionId(sessionId)
            .messageIndex(index)
            .sourceFile("chat.md")
            .build();
    }

    @Test
    void testDuplicateIngestionStoresOnce() {
        IngestionService service = service(ECHO);

        IngestionResult first = service.ingestMessage("I drink coffee every morning");
        IngestionResult second = service.ingestMessage("I drink coffee every morning");

        assertEquals(1, first.getPropositionsStored());
        assertEquals(0, first.getDuplicatesFound());
        assertEquals(1, second.getDuplicatesFound());
        assertEquals(0, second.getPropositionsStored());
        assertTrue(second.getNodeIds().isEmpty());
        assertEquals(1, second.getPropositions().size());
        assertEquals(1, stores.graphStore.countNodes(NodeVariant.LEAF));
    }

    @Test
    void testDuplicatesWithinOneMessageCaught() {
        IngestionService service = service(text -> List.of(
            proposition("Slept badly last night"),
            proposition("Slept badly last night"),
            proposition("Skipped breakfast")));

        IngestionResult result = service.ingestMessage("Slept badly and skipped breakfast");

        assertEquals(3, result.getPropositionsExtracted());
        assertEquals(2, result.getPropositionsStored());
        assertEquals(1, result.getDuplicatesFound());
        assertEquals(2, stores.graphStore.countNodes(NodeVariant.LEAF));
    }

    @Test
    void testRelatedBandLinksButDoesNotDeduplicate() {
        embeddings.register("base", FakeEmbeddingProvider.atSimilarity(1.0, DIMS));
        embeddings.register("related", FakeEmbeddingProvider.atSimilarity(0.90, DIMS));
        IngestionService service = service(ECHO);

        String baseId = service.ingestMessage("base").getNodeIds().get(0);
        IngestionResult result = service.ingestMessage("related");

        assertEquals(1, result.getPropositionsStored());
        assertEquals(0, result.getDuplicatesFound());
        assertEquals(1, result.getLinksCreated());

        List<RelatedNode> related = stores.graphStore.getRelated(result.getNodeIds().get(0));
        assertEquals(1, related.size());
        assertEquals(baseId, related.get(0).getNode().getId());
        assertEquals(EdgeType.SIMILAR_TO, related.get(0).getEdgeType());
        assertEquals(0.90, related.get(0).getEdge().getConfidence(), 1e-4);
    }

    @Test
    void testDuplicateBandRejected() {
        embeddings.register("base", FakeEmbeddingProvider.atSimilarity(1.0, DIMS));
        embeddings.register("near copy", FakeEmbeddingProvider.atSimilarity(0.97, DIMS));
        IngestionService service = service(ECHO);

        service.ingestMessage("base");
        IngestionResult result = service.ingestMessage("near copy");

        assertEquals(1, result.getDuplicatesFound());
        assertEquals(0, result.getPropositionsStored());
        assertEquals(0, result.getLinksCreated());
        assertEquals(1, stores.graphStore.countNodes(NodeVariant.LEAF));
    }

    @Test
    void testUnrelatedPropositionsNotLinked() {
        IngestionService service = service(ECHO);

        service.ingestMessage("Bought a new bike");
        IngestionResult result = service.ingestMessage("Exam on Friday");

        assertEquals(0, result.getLinksCreated());
        assertTrue(stores.graphStore.getRelated(result.getNodeIds().get(0)).isEmpty());
    }

    // unit vector at the given cosine to basis 0, leaning towards another axis
    private static float[] towards(double cosine, int axis) {
        float[] vector = new float[DIMS];
        vector[0] = (float) cosine;
        vector[axis] = (float) Math.sqrt(1.0 - cosine * cosine);
        return vector;
    }

    @Test
    void testLinksCappedAtMaximum() {
        properties.setMaxLinksPerNode(2);
        embeddings.register("query", FakeEmbeddingProvider.atSimilarity(1.0, DIMS));
        embeddings.register("n1", towards(0.86, 1));
        embeddings.register("n2", towards(0.88, 2));
        embeddings.register("n3", towards(0.92, 3));
        IngestionService service = service(ECHO);

        service.ingestMessage("n1");
        service.ingestMessage("n2");
        service.ingestMessage("n3");
        IngestionResult result = service.ingestMessage("query");

        assertEquals(2, result.getLinksCreated());
        List<Double> confidences = stores.graphStore.getRelated(result.getNodeIds().get(0), EdgeType.SIMILAR_TO)
            .stream()
            .map(r -> r.getEdge().getConfidence())
            .sorted(Comparator.reverseOrder())
            .toList();
        assertEquals(2, confidences.size());
        assertEquals(0.92, confidences.get(0), 1e-4);
        assertEquals(0.88, confidences.get(1), 1e-4);
    }

    @Test
    void testRunExampleEndToEnd() {
        String response = """
            {"propositions": [{
              "proposition": "Completed 5K run in 35 minutes at 6:54/km pace",
              "node_purpose": "observation",
              "confidence": 1.0,
              "source_type": "explicit",
              "structured_data": {"type": "training_session", "distance_meters": 5000,
                                  "duration_seconds": 2100, "pace_per_km_seconds": 414}
            }]}
            """;
        LlmExtractionProvider extractor = new LlmExtractionProvider(
            new OllamaChatService(FakeChatModel.replying(response)), new ObjectMapper());
        IngestionService service = service(extractor);

        IngestionResult first = service.ingestMessage("I ran 5K in 35 minutes at 6:54/km pace");

        assertEquals(1, first.getNodeIds().size());
        Node leaf = stores.graphStore.getNode(first.getNodeIds().get(0));
        BeliefDetails belief = leaf.asBelief();
        assertEquals(NodeVariant.LEAF, leaf.getVariant());
        assertEquals(NodePurpose.OBSERVATION, belief.getPurpose());
        assertEquals(NodeSource.CONVERSATION, belief.getSource());
        assertTrue(belief.getConfidence() >= 0.0 && belief.getConfidence() <= 1.0);
        Map<String, Object> data = belief.getStructuredData();
        assertNotNull(data);
        assertEquals(5000, data.get("distance_meters"));
        assertEquals(2100, data.get("duration_seconds"));
        assertEquals(414, data.get("pace_per_km_seconds"));
        assertEquals("completed-5k-run-in-35", leaf.getTitle());
        assertEquals(1, stores.embeddingStore.getEmbeddings(leaf.getId()).size());

        IngestionResult again = service.ingestMessage("I ran 5K in 35 minutes at 6:54/km pace");

        assertEquals(1, again.getDuplicatesFound());
        assertTrue(again.getNodeIds().isEmpty());
        assertEquals(1, stores.graphStore.countNodes(NodeVariant.LEAF));
    }

    @Test
    void testProvenanceRecorded() {
        IngestionService service = service(ECHO);
        Instant said = Instant.parse("2025-01-31T10:15:32Z");

        IngestionResult result = service.ingestMessage("Knee felt fine on the hills", SessionMetadata.builder()
            .sessionId("s-1")
            .messageIndex(4)
            .sourceCharStart(10)
            .sourceCharEnd(90)
            .sourceFile("chat.md")
            .timestamp(said)
            .build());

        assertEquals("s-1", result.getSessionId());
        List<Node> session = stores.graphStore.findBySession("s-1");
        assertEquals(1, session.size());
        BeliefDetails belief = session.get(0).asBelief();
        assertEquals(said, belief.getValidFrom());
        assertEquals(4, belief.getProvenance().getMessageIndex());
        assertEquals("chat.md", belief.getProvenance().getSourceFile());
        assertNotNull(belief.getRecordedAt());
    }

    @Test
    void testBatchContinuesPastFailedMessage() {
        IngestionService service = service(text -> {
            if (text.equals("message 1")) {
                throw new ExtractionException("Response missing 'propositions' key");
            }
            return List.of(proposition(text));
        });

        BatchIngestionResult batch = service.ingestBatch(List.of(
            userMessage(0, "message 0", "s-1"),
            userMessage(1, "message 1", "s-1"),
            userMessage(2, "message 2", "s-1")));

        assertEquals(3, batch.getTotalMessages());
        assertEquals(1, batch.getErrors().size());
        IngestionError error = batch.getErrors().get(0);
        assertEquals(1, error.getMessageIndex());
        assertEquals(ErrorKind.EXTRACTION, error.getKind());
        assertEquals("chat.md", error.getSourceFile());
        assertEquals(2, batch.getTotalExtracted());
        assertEquals(2, batch.getTotalStored());
        assertEquals(1, batch.getSessionsProcessed());
        assertFalse(batch.isAborted());
    }

    @Test
    void testAssistantMessagesSkipped() {
        List<String> seen = new ArrayList<>();
        IngestionService service = service(text -> {
            seen.add(text);
            return List.of(proposition(text));
        });

        BatchIngestionResult batch = service.ingestBatch(List.of(
            userMessage(0, "Started a new job", "s-1"),
            ConversationMessage.builder()
                .text("Congratulations on the new job")
                .role(MessageRole.ASSISTANT)
                .sessionId("s-1")
                .messageIndex(1)
                .build(),
            userMessage(2, "Commute is an hour", "s-2")));

        assertEquals(List.of("Started a new job", "Commute is an hour"), seen);
        assertEquals(3, batch.getTotalMessages());
        assertEquals(2, batch.getTotalStored());
        assertEquals(2, batch.getSessionsProcessed());
    }

    @Test
    void testStorageFailureStopsBatch() throws Exception {
        // the provider's vectors pass its own check but not the store's configured width
        embeddings = new FakeEmbeddingProvider(4);
        IngestionService service = service(ECHO);

        BatchIngestionResult batch = service.ingestBatch(List.of(
            userMessage(0, "first", "s-1"),
            userMessage(1, "second", "s-1")));

        assertTrue(batch.isAborted());
        assertEquals(1, batch.getErrors().size());
        assertEquals(ErrorKind.STORAGE, batch.getErrors().get(0).getKind());
        assertEquals(0, batch.getErrors().get(0).getMessageIndex());
        assertEquals(0, stores.graphStore.countNodes(NodeVariant.LEAF));
        assertEquals(0, stores.embeddingStore.count(EmbeddingType.CONTENT));
    }

    @Test
    void testFailedEmbeddingWriteLeavesNoLeafBehind() {
        embeddings = new FakeEmbeddingProvider(4);
        IngestionService narrow = service(ECHO);

        StorageException e = assertThrows(StorageException.class, () -> narrow.ingestMessage("Walked to work"));
        assertInstanceOf(ValidationException.class, e.getCause());
        assertEquals(0, stores.graphStore.countNodes(null));
        assertEquals(0, stores.index.size(EmbeddingType.CONTENT));

        // the same text goes in cleanly once embeddings fit, and only once
        embeddings = new FakeEmbeddingProvider(DIMS);
        IngestionService service = service(ECHO);
        assertEquals(1, service.ingestMessage("Walked to work").getPropositionsStored());
        assertEquals(1, service.ingestMessage("Walked to work").getDuplicatesFound());
        assertEquals(1, stores.graphStore.countNodes(NodeVariant.LEAF));
    }

    @Test
    void testLinkFailureKeepsStoredLeaf() {
        embeddings.register("base", FakeEmbeddingProvider.atSimilarity(1.0, DIMS));
        embeddings.register("related", FakeEmbeddingProvider.atSimilarity(0.90, DIMS));
        GraphStore edgesFail = new SqliteGraphStore(stores.dataSource, new ObjectMapper()) {
            @Override
            public Edge createEdge(String fromId, String toId, EdgeType type, EdgeProperties properties) {
                if (type == EdgeType.SIMILAR_TO) {
                    throw new StorageException("database is locked");
                }
                return super.createEdge(fromId, toId, type, properties);
            }
        };
        IngestionService service = service(ECHO, edgesFail);

        service.ingestMessage("base");
        IngestionResult result = service.ingestMessage("related");

        assertEquals(1, result.getPropositionsStored());
        assertEquals(0, result.getLinksCreated());
        String leafId = result.getNodeIds().get(0);
        assertEquals(NodeVariant.LEAF, stores.graphStore.getNode(leafId).getVariant());
        assertTrue(stores.embeddingStore.getEmbedding(leafId, EmbeddingType.CONTENT).isPresent());
        assertTrue(stores.graphStore.getEdges(leafId).isEmpty());
        assertEquals(2, stores.graphStore.countNodes(NodeVariant.LEAF));
    }

    @Test
    void testExtractionTimeoutIsProviderError() {
        properties.setExtractionTimeout(Duration.ofMillis(100));
        IngestionService service = service(text -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(proposition(text));
        });

        ProviderException e = assertThrows(ProviderException.class, () -> service.ingestMessage("slow"));
        assertTrue(e.getMessage().contains("timed out"));
        assertEquals(0, stores.graphStore.countNodes(null));
    }

    @Test
    void testExtractionErrorPassesThroughUnchanged() {
        IngestionService service = service(text -> {
            throw new ExtractionException("bad payload");
        });

        ExtractionException e = assertThrows(ExtractionException.class, () -> service.ingestMessage("x"));
        assertEquals("bad payload", e.getMessage());
    }

    @Test
    void testBlankAndEmptyMessages() {
        IngestionService service = service(text -> List.of());

        assertEquals(0, service.ingestMessage("   ").getPropositionsExtracted());
        assertEquals(0, service.ingestMessage("Nothing to say").getPropositionsStored());
        assertEquals(0, embeddings.getCalls());
    }

    @Test
    void testDirectoryIngestion() throws Exception {
        Files.writeString(tempDir.resolve("01-run.md"), """
            **Link:** https://claude.ai/chat/11111111-1111-1111-1111-111111111111

            ## Prompt:
            2/1/2025, 7:00:00 AM

            Ran intervals on the track

            ## Response:
            2/1/2025, 7:00:05 AM

            Good session.
            """);
        Files.writeString(tempDir.resolve("02-broken.md"), "no sections here\n");
        Files.writeString(tempDir.resolve("03-sleep.md"), """
            **Link:** https://claude.ai/chat/22222222-2222-2222-2222-222222222222

            ## Prompt:
            Slept eight hours

            ## Prompt:
            Woke up rested
            """);
        IngestionService service = service(ECHO);

        BatchIngestionResult batch = service.ingestDirectory(tempDir);

        assertEquals(4, batch.getTotalMessages());
        assertEquals(3, batch.getTotalStored());
        assertEquals(2, batch.getSessionsProcessed());
        assertEquals(1, batch.getErrors().size());
        IngestionError parseError = batch.getErrors().get(0);
        assertNull(parseError.getMessageIndex());
        assertEquals("02-broken.md", parseError.getSourceFile());
        assertEquals(ErrorKind.PARSE, parseError.getKind());

        List<Node> run = stores.graphStore.findBySession("11111111-1111-1111-1111-111111111111");
        assertEquals(1, run.size());
        assertEquals(Instant.parse("2025-02-01T07:00:00Z"), run.get(0).asBelief().getValidFrom());
    }
}
