package com.dcruver.beliefgraph.app;

import com.dcruver.beliefgraph.domain.BeliefDetails;
import com.dcruver.beliefgraph.domain.Edge;
import com.dcruver.beliefgraph.domain.EdgeProperties;
import com.dcruver.beliefgraph.domain.EdgeType;
import com.dcruver.beliefgraph.domain.EmbeddingType;
import com.dcruver.beliefgraph.domain.ModuleIntentions;
import com.dcruver.beliefgraph.domain.ModuleTree;
import com.dcruver.beliefgraph.domain.Node;
import com.dcruver.beliefgraph.domain.NodeStatus;
import com.dcruver.beliefgraph.domain.NodeVariant;
import com.dcruver.beliefgraph.domain.RelatedNode;
import com.dcruver.beliefgraph.exception.BeliefGraphException;
import com.dcruver.beliefgraph.graph.EmbeddingStore;
import com.dcruver.beliefgraph.graph.GraphStore;
import com.dcruver.beliefgraph.index.SimilarityMatch;
import com.dcruver.beliefgraph.ingest.BatchIngestionResult;
import com.dcruver.beliefgraph.ingest.IngestionError;
import com.dcruver.beliefgraph.ingest.IngestionResult;
import com.dcruver.beliefgraph.ingest.IngestionService;
import com.dcruver.beliefgraph.nlp.EmbeddingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring Shell commands for ingesting conversations and inspecting the belief graph.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class GraphShellCommands {

    private final IngestionService ingestionService;
    private final GraphStore graphStore;
    private final EmbeddingStore embeddingStore;
    private final EmbeddingProvider embeddingProvider;

    @ShellMethod(key = "ingest", value = "Extract and store propositions from a piece of text")
    public String ingest(@ShellOption String text) {
        try {
            IngestionResult result = ingestionService.ingestMessage(text);

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Extracted: %d\n", result.getPropositionsExtracted()));
            sb.append(String.format("Stored: %d\n", result.getPropositionsStored()));
            sb.append(String.format("Duplicates: %d\n", result.getDuplicatesFound()));
            sb.append(String.format("Links: %d\n", result.getLinksCreated()));
            for (String nodeId : result.getNodeIds()) {
                Node node = graphStore.getNode(nodeId);
                sb.append(String.format("  + %s  %s\n", nodeId, node.getContent()));
            }
            return sb.toString();

        } catch (BeliefGraphException e) {
            log.error("Ingestion failed", e);
            return "Ingestion failed [" + e.getKind() + "]: " + e.getMessage();
        }
    }

    @ShellMethod(key = "ingest-file", value = "Ingest an exported conversation transcript")
    public String ingestFile(@ShellOption String path) {
        try {
            return formatBatch("File " + path, ingestionService.ingestFile(Path.of(path)));
        } catch (BeliefGraphException e) {
            log.error("Ingestion of {} failed", path, e);
            return "Ingestion failed [" + e.getKind() + "]: " + e.getMessage();
        }
    }

    @ShellMethod(key = "ingest-dir", value = "Ingest every .md transcript in a directory")
    public String ingestDir(@ShellOption String path) {
        try {
            return formatBatch("Directory " + path, ingestionService.ingestDirectory(Path.of(path)));
        } catch (BeliefGraphException e) {
            log.error("Ingestion of {} failed", path, e);
            return "Ingestion failed [" + e.getKind() + "]: " + e.getMessage();
        }
    }

    @ShellMethod(key = "node", value = "Show a node and its edges")
    public String node(@ShellOption String id) {
        try {
            Node node = graphStore.getNode(id);

            StringBuilder sb = new StringBuilder(describe(node));
            List<Edge> edges = graphStore.getEdges(id);
            if (!edges.isEmpty()) {
                sb.append("\nEdges:\n");
                for (Edge edge : edges) {
                    sb.append(String.format("  %s %s -> %s%s\n", edge.getType(), edge.getFromId(), edge.getToId(),
                        edge.getConfidence() == null ? "" : String.format(" (%.3f)", edge.getConfidence())));
                }
            }
            return sb.toString();

        } catch (BeliefGraphException e) {
            return "Failed to show node: " + e.getMessage();
        }
    }

    @ShellMethod(key = "children", value = "List nodes contained by a module or internal node")
    public String children(@ShellOption String id,
                           @ShellOption(defaultValue = "1") int depth) {
        try {
            if (depth > 1) {
                StringBuilder sb = new StringBuilder();
                appendTree(sb, graphStore.getModuleTree(id, depth), 0);
                return sb.toString();
            }

            List<Node> children = graphStore.getChildren(id);
            if (children.isEmpty()) {
                return "No children.";
            }
            StringBuilder sb = new StringBuilder();
            for (Node child : children) {
                sb.append(String.format("%s  [%s] %s\n", child.getId(), child.getVariant(), child.getTitle()));
            }
            return sb.toString();

        } catch (BeliefGraphException e) {
            return "Failed to list children: " + e.getMessage();
        }
    }

    @ShellMethod(key = "related", value = "List nodes linked by relationship edges")
    public String related(@ShellOption String id,
                          @ShellOption(defaultValue = ShellOption.NULL) String type) {
        try {
            List<RelatedNode> related;
            if (type == null) {
                related = graphStore.getRelated(id);
            } else {
                EdgeType edgeType = EdgeType.parse(type).orElse(null);
                if (edgeType == null) {
                    return "Unknown edge type: " + type;
                }
                related = graphStore.getRelated(id, edgeType);
            }

            if (related.isEmpty()) {
                return "No related nodes.";
            }
            StringBuilder sb = new StringBuilder();
            for (RelatedNode r : related) {
                sb.append(String.format("%-8s %-11s %s  %s\n",
                    r.getDirection(), r.getEdgeType(), r.getNode().getId(), r.getNode().getTitle()));
            }
            return sb.toString();

        } catch (BeliefGraphException e) {
            return "Failed to list related nodes: " + e.getMessage();
        }
    }

    @ShellMethod(key = "link", value = "Create an edge between two nodes")
    public String link(@ShellOption String from,
                       @ShellOption String to,
                       @ShellOption String type,
                       @ShellOption(defaultValue = ShellOption.NULL) Double confidence,
                       @ShellOption(defaultValue = ShellOption.NULL) String rationale) {
        try {
            Edge edge = graphStore.createEdge(from, to, type, EdgeProperties.builder()
                .confidence(confidence)
                .rationale(rationale)
                .build());
            return String.format("Created %s edge %s (%s -> %s)", edge.getType(), edge.getId(), from, to);

        } catch (BeliefGraphException e) {
            return "Failed to create edge [" + e.getKind() + "]: " + e.getMessage();
        }
    }

    @ShellMethod(key = "module create", value = "Declare a new module")
    public String moduleCreate(@ShellOption String title,
                               @ShellOption String primary,
                               @ShellOption(defaultValue = "") String description,
                               @ShellOption(defaultValue = ShellOption.NULL) String definitionOfDone,
                               @ShellOption(defaultValue = "0") int priority,
                               @ShellOption(defaultValue = "5") int depth) {
        try {
            ModuleIntentions intentions = ModuleIntentions.builder()
                .primary(primary)
                .secondary(List.of())
                .definitionOfDone(definitionOfDone)
                .declaredPriority(priority)
                .build();
            Node module = graphStore.createModule(title, description, intentions, priority, depth);
            return "Created module " + module.getId();

        } catch (BeliefGraphException e) {
            return "Failed to create module: " + e.getMessage();
        }
    }

    @ShellMethod(key = "status set", value = "Change the lifecycle status of a belief node")
    public String statusSet(@ShellOption String id, @ShellOption String status) {
        try {
            NodeStatus newStatus;
            try {
                newStatus = NodeStatus.fromValue(status);
            } catch (IllegalArgumentException e) {
                return "Unknown status: " + status;
            }
            Node node = graphStore.updateStatus(id, newStatus);
            return String.format("Node %s is now %s", node.getId(), node.asBelief().getStatus().getValue());

        } catch (BeliefGraphException e) {
            return "Failed to set status: " + e.getMessage();
        }
    }

    @ShellMethod(key = "similar", value = "Find stored nodes similar to a piece of text")
    public String similar(@ShellOption String text,
                          @ShellOption(defaultValue = "0.85") double threshold,
                          @ShellOption(defaultValue = "5") int limit) {
        try {
            float[] query = embeddingProvider.embed(text);
            List<SimilarityMatch> matches = embeddingStore.findSimilar(query, EmbeddingType.CONTENT, threshold, limit);
            if (matches.isEmpty()) {
                return "No similar nodes.";
            }

            StringBuilder sb = new StringBuilder();
            for (SimilarityMatch match : matches) {
                Node node = graphStore.getNode(match.getNodeId());
                sb.append(String.format("%.3f  %s  %s\n", match.getScore(), node.getId(), node.getContent()));
            }
            return sb.toString();

        } catch (BeliefGraphException e) {
            return "Similarity search failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "reindex", value = "Rebuild the similarity index from stored embeddings")
    public String reindex() {
        try {
            int loaded = embeddingStore.rebuildIndex();
            return "Similarity index rebuilt: " + loaded + " vectors";
        } catch (BeliefGraphException e) {
            log.error("Reindex failed", e);
            return "Reindex failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "stats", value = "Show node and embedding counts")
    public String stats() {
        try {
            StringBuilder sb = new StringBuilder("Belief Graph\n\n");
            for (NodeVariant variant : NodeVariant.values()) {
                sb.append(String.format("- %s nodes: %d\n", variant, graphStore.countNodes(variant)));
            }
            sb.append(String.format("- Content embeddings: %d\n", embeddingStore.count(EmbeddingType.CONTENT)));
            return sb.toString();
        } catch (BeliefGraphException e) {
            return "Failed to get stats: " + e.getMessage();
        }
    }

    private String formatBatch(String label, BatchIngestionResult batch) {
        StringBuilder sb = new StringBuilder();
        sb.append(label).append(batch.isAborted() ? " (stopped early)\n\n" : "\n\n");
        sb.append(String.format("- Messages: %d\n", batch.getTotalMessages()));
        sb.append(String.format("- Sessions: %d\n", batch.getSessionsProcessed()));
        sb.append(String.format("- Extracted: %d\n", batch.getTotalExtracted()));
        sb.append(String.format("- Stored: %d\n", batch.getTotalStored()));
        sb.append(String.format("- Duplicates: %d\n", batch.getTotalDuplicates()));
        sb.append(String.format("- Links: %d\n", batch.getTotalLinks()));
        if (batch.hasErrors()) {
            sb.append(String.format("\nErrors (%d):\n", batch.getErrors().size()));
            for (IngestionError error : batch.getErrors()) {
                sb.append("  ").append(error).append("\n");
            }
        }
        return sb.toString();
    }

    private String describe(Node node) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s [%s]\n", node.getId(), node.getVariant()));
        sb.append(String.format("Title: %s\n", node.getTitle()));
        sb.append(String.format("Created: %s\n", node.getCreatedAt()));
        if (node.getDetails() instanceof BeliefDetails belief) {
            sb.append(String.format("Status: %s\n", belief.getStatus().getValue()));
            sb.append(String.format("Purpose: %s\n", belief.getPurpose() == null ? "-" : belief.getPurpose().getValue()));
            sb.append(String.format("Confidence: %.2f\n", belief.getConfidence()));
            if (belief.getStructuredData() != null) {
                sb.append(String.format("Data: %s\n", belief.getStructuredData()));
            }
            if (belief.getProvenance() != null) {
                sb.append(String.format("Source: %s #%s\n",
                    belief.getProvenance().getSourceFile(), belief.getProvenance().getMessageIndex()));
            }
        }
        sb.append("\n").append(node.getContent()).append("\n");
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, ModuleTree tree, int level) {
        sb.append("  ".repeat(level))
            .append(String.format("%s [%s] %s\n", tree.getNode().getId(), tree.getNode().getVariant(),
                tree.getNode().getTitle()));
        for (ModuleTree child : tree.getChildren()) {
            appendTree(sb, child, level + 1);
        }
    }
}
