package com.dcruver.beliefgraph.ingest;

import com.dcruver.beliefgraph.config.IngestionProperties;
import com.dcruver.beliefgraph.domain.BeliefDetails;
import com.dcruver.beliefgraph.domain.EdgeProperties;
import com.dcruver.beliefgraph.domain.EdgeType;
import com.dcruver.beliefgraph.domain.EmbeddingType;
import com.dcruver.beliefgraph.domain.Node;
import com.dcruver.beliefgraph.domain.NodeSource;
import com.dcruver.beliefgraph.domain.NodeStatus;
import com.dcruver.beliefgraph.domain.Proposition;
import com.dcruver.beliefgraph.exception.BeliefGraphException;
import com.dcruver.beliefgraph.exception.ErrorKind;
import com.dcruver.beliefgraph.exception.ProviderException;
import com.dcruver.beliefgraph.exception.StorageException;
import com.dcruver.beliefgraph.exception.ValidationException;
import com.dcruver.beliefgraph.graph.EmbeddingStore;
import com.dcruver.beliefgraph.graph.GraphStore;
import com.dcruver.beliefgraph.index.InMemorySimilarityIndex;
import com.dcruver.beliefgraph.index.SimilarityMatch;
import com.dcruver.beliefgraph.io.ConversationMessage;
import com.dcruver.beliefgraph.io.ConversationParser;
import com.dcruver.beliefgraph.nlp.EmbeddingProvider;
import com.dcruver.beliefgraph.nlp.ExtractionProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ingestion pipeline: extract, embed, dedup, store, link.
 *
 * Propositions are handled one at a time so every dedup decision sees everything
 * classified before it, including earlier propositions of the same message. Nodes
 * are written before their embeddings, in the same transaction, and linking starts
 * only after every unique proposition of the message is stored.
 *
 * One writer at a time: all ingestion through this service holds a single lock, which
 * keeps the similarity index and the embeddings table coherent.
 */
@Service
@Slf4j
public class IngestionService {

    private final ExtractionProvider extractionProvider;
    private final EmbeddingProvider embeddingProvider;
    private final GraphStore graphStore;
    private final EmbeddingStore embeddingStore;
    private final ConversationParser parser;
    private final IngestionProperties properties;

    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final ExecutorService callExecutor;

    public IngestionService(
        ExtractionProvider extractionProvider,
        EmbeddingProvider embeddingProvider,
        GraphStore graphStore,
        EmbeddingStore embeddingStore,
        ConversationParser parser,
        IngestionProperties properties,
        PlatformTransactionManager transactionManager
    ) {
        this.extractionProvider = extractionProvider;
        this.embeddingProvider = embeddingProvider;
        this.graphStore = graphStore;
        this.embeddingStore = embeddingStore;
        this.parser = parser;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);

        AtomicInteger threadCount = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "ingestion-call-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    // =========================================================================
    // Single message
    // =========================================================================

    public IngestionResult ingestMessage(String text) {
        return ingestMessage(text, SessionMetadata.none());
    }

    /**
     * Ingest one message.
     *
     * @throws ProviderException if extraction or embedding is unreachable or times out
     * @throws com.dcruver.beliefgraph.exception.ExtractionException if the extraction response is invalid
     * @throws StorageException if a node or its embedding could not be written
     */
    public IngestionResult ingestMessage(String text, SessionMetadata metadata) {
        SessionMetadata session = metadata == null ? SessionMetadata.none() : metadata;
        writeLock.lock();
        try {
            return process(text, session);
        } finally {
            writeLock.unlock();
        }
    }

    private IngestionResult process(String text, SessionMetadata session) {
        if (text == null || text.isBlank()) {
            return IngestionResult.empty(session.getSessionId());
        }

        List<Proposition> propositions = callWithTimeout(
            () -> extractionProvider.extract(text), properties.getExtractionTimeout(), "Extraction");
        if (propositions == null || propositions.isEmpty()) {
            log.debug("No propositions extracted from message {}", session.getMessageIndex());
            return IngestionResult.empty(session.getSessionId());
        }

        // Classify
        InMemorySimilarityIndex pending = new InMemorySimilarityIndex();
        List<Classified> uniques = new ArrayList<>();
        int duplicates = 0;
        for (Proposition proposition : propositions) {
            float[] vector = callWithTimeout(
                () -> embeddingProvider.embed(proposition.getText()), properties.getEmbeddingTimeout(), "Embedding");
            requireDimensions(vector);

            if (isDuplicate(vector, pending)) {
                duplicates++;
                log.debug("Duplicate proposition skipped: {}", proposition.getText());
                continue;
            }
            pending.insert("pending-" + uniques.size(), EmbeddingType.CONTENT, vector);
            uniques.add(new Classified(proposition, vector));
        }

        // Store: node row then its embedding, committed together
        Instant recordedAt = Instant.ofEpochMilli(System.currentTimeMillis());
        List<Stored> stored = new ArrayList<>();
        for (Classified item : uniques) {
            stored.add(new Stored(storeLeaf(item, session, recordedAt), item.vector));
        }

        int links = link(stored);

        List<String> nodeIds = stored.stream().map(s -> s.nodeId).toList();
        log.info("Ingested message {}: {} extracted, {} stored, {} duplicates, {} links",
            session.getMessageIndex() == null ? "-" : session.getMessageIndex(),
            propositions.size(), nodeIds.size(), duplicates, links);

        return IngestionResult.builder()
            .nodeIds(nodeIds)
            .propositions(List.copyOf(propositions))
            .duplicatesFound(duplicates)
            .propositionsExtracted(propositions.size())
            .propositionsStored(nodeIds.size())
            .linksCreated(links)
            .sessionId(session.getSessionId())
            .build();
    }

    private String storeLeaf(Classified item, SessionMetadata session, Instant recordedAt) {
        try {
            return transactionTemplate.execute(tx -> {
                Node node = graphStore.createLeaf(
                    TitleSlugs.slugify(item.proposition.getText(), properties.getTitleWords()),
                    item.proposition.getText(),
                    toDetails(item.proposition, session, recordedAt));
                try {
                    embeddingStore.store(node.getId(), EmbeddingType.CONTENT, item.vector,
                        embeddingProvider.getModelName());
                } catch (BeliefGraphException e) {
                    throw new StorageException("Embedding for leaf " + node.getId()
                        + " could not be written; the leaf was rolled back", e);
                }
                return node.getId();
            });
        } catch (TransactionException e) {
            throw new StorageException("Failed to commit leaf for: " + item.proposition.getText(), e);
        }
    }

    private boolean isDuplicate(float[] vector, InMemorySimilarityIndex pending) {
        double threshold = properties.getDedupThreshold();
        return !embeddingStore.findSimilar(vector, EmbeddingType.CONTENT, threshold, 1).isEmpty()
            || !pending.findSimilar(vector, EmbeddingType.CONTENT, threshold, 1).isEmpty();
    }

    private void requireDimensions(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new ProviderException("Embedding provider returned no vector");
        }
        int expected = embeddingProvider.getDimensions();
        if (expected > 0 && vector.length != expected) {
            throw new ValidationException(String.format(
                "Embedding has %d dimensions, %s produces %d", vector.length, embeddingProvider.getModelName(), expected));
        }
    }

    private BeliefDetails toDetails(Proposition proposition, SessionMetadata session, Instant recordedAt) {
        return BeliefDetails.leaf()
            .status(NodeStatus.CONFIRMED)
            .source(NodeSource.CONVERSATION)
            .confidence(proposition.getConfidence())
            .purpose(proposition.getPurpose())
            .sourceType(proposition.getSourceType())
            .validFrom(session.getTimestamp())
            .recordedAt(recordedAt)
            .structuredData(proposition.hasStructuredData() ? proposition.getStructuredData() : null)
            .provenance(session.toProvenance())
            .build();
    }

    /**
     * SIMILAR_TO edges from each new node to its best matches in the related band.
     * Failures here never undo stored nodes.
     */
    private int link(List<Stored> created) {
        int links = 0;
        Set<String> linkedPairs = new HashSet<>();
        for (Stored node : created) {
            List<SimilarityMatch> candidates;
            try {
                candidates = embeddingStore.findSimilar(
                    node.vector, EmbeddingType.CONTENT, properties.getLinkThreshold(), Integer.MAX_VALUE);
            } catch (BeliefGraphException e) {
                log.debug("Link lookup failed for node {}: {}", node.nodeId, e.getMessage());
                continue;
            }

            int linked = 0;
            for (SimilarityMatch match : candidates) {
                if (linked >= properties.getMaxLinksPerNode()) {
                    break;
                }
                if (match.getNodeId().equals(node.nodeId) || match.getScore() >= properties.getDedupThreshold()) {
                    continue;
                }
                // the reverse edge already exists when both ends are new
                if (linkedPairs.contains(match.getNodeId() + "|" + node.nodeId)) {
                    continue;
                }
                try {
                    graphStore.createEdge(node.nodeId, match.getNodeId(), EdgeType.SIMILAR_TO,
                        EdgeProperties.withConfidence(match.getScore()));
                    linkedPairs.add(node.nodeId + "|" + match.getNodeId());
                    linked++;
                } catch (BeliefGraphException e) {
                    log.debug("Skipped SIMILAR_TO {} -> {}: {}", node.nodeId, match.getNodeId(), e.getMessage());
                }
            }
            links += linked;
        }
        return links;
    }

    // =========================================================================
    // Batches
    // =========================================================================

    /**
     * Ingest a conversation. Only user messages are extracted. A failing message is
     * recorded and skipped, except for storage failures, which stop the batch.
     */
    public BatchIngestionResult ingestBatch(List<ConversationMessage> messages) {
        BatchIngestionResult batch = new BatchIngestionResult();
        batch.setTotalMessages(messages.size());
        Set<String> sessions = new LinkedHashSet<>();

        for (ConversationMessage message : messages) {
            if (!message.isUser()) {
                continue;
            }
            if (message.getSessionId() != null) {
                sessions.add(message.getSessionId());
            }

            try {
                batch.add(ingestMessage(message.getText(), SessionMetadata.from(message)));
            } catch (BeliefGraphException e) {
                batch.getErrors().add(new IngestionError(
                    message.getMessageIndex(), message.getSourceFile(), e.getKind(), e.getMessage()));
                log.error("Message {} of {} failed ({}): {}",
                    message.getMessageIndex(), message.getSourceFile(), e.getKind(), e.getMessage());
                if (e.getKind() == ErrorKind.STORAGE) {
                    log.error("Stopping batch after storage failure");
                    batch.setAborted(true);
                    break;
                }
            }
        }

        batch.setSessionsProcessed(sessions.size());
        log.info("Batch done: {} messages, {} extracted, {} stored, {} duplicates, {} errors",
            batch.getTotalMessages(), batch.getTotalExtracted(), batch.getTotalStored(),
            batch.getTotalDuplicates(), batch.getErrors().size());
        return batch;
    }

    /**
     * Parse and ingest one transcript file.
     *
     * @throws com.dcruver.beliefgraph.exception.ConversationFormatException if the file cannot be parsed
     */
    public BatchIngestionResult ingestFile(Path file) {
        return ingestBatch(parser.parseFile(file));
    }

    /**
     * Ingest every {@code *.md} transcript in a directory, in file name order. Parse failures
     * are recorded per file; session ids are counted across all files.
     */
    public BatchIngestionResult ingestDirectory(Path directory) {
        BatchIngestionResult aggregate = new BatchIngestionResult();
        Set<String> sessions = new LinkedHashSet<>();

        for (Path file : parser.listTranscripts(directory)) {
            List<ConversationMessage> messages;
            try {
                messages = parser.parseFile(file);
            } catch (BeliefGraphException e) {
                aggregate.getErrors().add(new IngestionError(
                    null, file.getFileName().toString(), e.getKind(), e.getMessage()));
                log.error("Skipping {}: {}", file.getFileName(), e.getMessage());
                continue;
            }

            aggregate.merge(ingestBatch(messages));
            messages.stream()
                .filter(ConversationMessage::isUser)
                .map(ConversationMessage::getSessionId)
                .forEach(sessions::add);

            if (aggregate.isAborted()) {
                break;
            }
        }

        aggregate.setSessionsProcessed(sessions.size());
        return aggregate;
    }

    // =========================================================================
    // Bounded collaborator calls
    // =========================================================================

    private <T> T callWithTimeout(Callable<T> call, Duration timeout, String what) {
        Future<T> future = callExecutor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderException(what + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderException(what + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BeliefGraphException graphException) {
                throw graphException;
            }
            throw new ProviderException(what + " failed: " + cause.getMessage(), cause);
        }
    }

    private static final class Classified {
        private final Proposition proposition;
        private final float[] vector;

        private Classified(Proposition proposition, float[] vector) {
            this.proposition = proposition;
            this.vector = vector;
        }
    }

    private static final class Stored {
        private final String nodeId;
        private final float[] vector;

        private Stored(String nodeId, float[] vector) {
            this.nodeId = nodeId;
            this.vector = vector;
        }
    }
}
