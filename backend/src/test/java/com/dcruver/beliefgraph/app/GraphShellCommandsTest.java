package com.dcruver.beliefgraph.app;

import com.dcruver.beliefgraph.config.IngestionProperties;
import com.dcruver.beliefgraph.domain.BeliefDetails;
import com.dcruver.beliefgraph.domain.Node;
import com.dcruver.beliefgraph.domain.NodePurpose;
import com.dcruver.beliefgraph.domain.NodeStatus;
import com.dcruver.beliefgraph.domain.Proposition;
import com.dcruver.beliefgraph.domain.SourceType;
import com.dcruver.beliefgraph.ingest.IngestionService;
import com.dcruver.beliefgraph.io.ConversationParser;
import com.dcruver.beliefgraph.support.FakeEmbeddingProvider;
import com.dcruver.beliefgraph.support.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphShellCommandsTest {

    @TempDir
    Path tempDir;

    private TestStores stores;
    private IngestionService ingestionService;
    private GraphShellCommands commands;

    @BeforeEach
    void setUp() throws Exception {
        stores = TestStores.open(tempDir.resolve("graph.db"), 8);
        FakeEmbeddingProvider embeddings = new FakeEmbeddingProvider(8);
        ingestionService = new IngestionService(
            text -> List.of(Proposition.builder()
                .text(text)
                .purpose(NodePurpose.BELIEF)
                .confidence(0.8)
                .sourceType(SourceType.EXPLICIT)
                .build()),
            embeddings, stores.graphStore, stores.embeddingStore, new ConversationParser(), new IngestionProperties(),
            stores.transactionManager);
        commands = new GraphShellCommands(ingestionService, stores.graphStore, stores.embeddingStore, embeddings);
    }

    @AfterEach
    void tearDown() {
        ingestionService.shutdown();
    }

    @Test
    void testIngestReportsCounts() {
        String output = commands.ingest("Cold showers help me focus");

        assertTrue(output.contains("Stored: 1"));
        assertTrue(output.contains("Cold showers help me focus"));
        assertTrue(commands.ingest("Cold showers help me focus").contains("Duplicates: 1"));
    }

    @Test
    void testLinkRejectionIsReported() {
        Node a = stores.graphStore.createLeaf("a", "a", BeliefDetails.leaf().build());
        Node b = stores.graphStore.createLeaf("b", "b", BeliefDetails.leaf().build());

        assertTrue(commands.link(a.getId(), b.getId(), "supports", 0.7, "same run").startsWith("Created SUPPORTS"));
        assertTrue(commands.link(a.getId(), b.getId(), "contains", null, null).contains("VALIDATION"));
        assertTrue(commands.link(a.getId(), "missing", "supports", null, null).contains("LOOKUP"));
        assertTrue(commands.link(a.getId(), b.getId(), "causes", null, null).contains("VALIDATION"));
    }

    @Test
    void testModuleAndChildren() {
        String created = commands.moduleCreate("Running", "Finish a half marathon", "", null, 1, 5);
        String moduleId = created.substring("Created module ".length());
        Node leaf = stores.graphStore.createLeaf("leaf", "Long run on Sunday", BeliefDetails.leaf().build());

        commands.link(moduleId, leaf.getId(), "contains", null, null);

        assertTrue(commands.children(moduleId, 1).contains(leaf.getId()));
        assertTrue(commands.children(leaf.getId(), 1).contains("No children"));
    }

    @Test
    void testStatusSet() {
        Node leaf = stores.graphStore.createLeaf("leaf", "Stretching daily", BeliefDetails.leaf().build());

        assertEquals("Node " + leaf.getId() + " is now faded", commands.statusSet(leaf.getId(), "faded"));
        assertEquals(NodeStatus.FADED, stores.graphStore.getNode(leaf.getId()).asBelief().getStatus());
        assertEquals("Unknown status: retired", commands.statusSet(leaf.getId(), "retired"));
    }

    @Test
    void testStatsAndReindex() {
        commands.ingest("Tea after dinner");

        assertTrue(commands.stats().contains("LEAF nodes: 1"));
        assertEquals("Similarity index rebuilt: 1 vectors", commands.reindex());
    }
}
