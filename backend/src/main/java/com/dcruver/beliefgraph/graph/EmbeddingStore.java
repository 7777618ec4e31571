package com.dcruver.beliefgraph.graph;

import com.dcruver.beliefgraph.domain.EmbeddingType;
import com.dcruver.beliefgraph.domain.StoredEmbedding;
import com.dcruver.beliefgraph.exception.LookupException;
import com.dcruver.beliefgraph.exception.StorageException;
import com.dcruver.beliefgraph.exception.ValidationException;
import com.dcruver.beliefgraph.index.SimilarityIndex;
import com.dcruver.beliefgraph.index.SimilarityMatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stores node embeddings in SQLite and keeps the similarity index in step with them.
 *
 * The table is the source of truth: the index is rebuilt from it on startup and
 * whenever {@link #rebuildIndex()} is called.
 */
@Component
@Slf4j
public class EmbeddingStore {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final GraphStore graphStore;
    private final SimilarityIndex index;
    private final int expectedDimensions;

    public EmbeddingStore(
        DataSource dataSource,
        ObjectMapper objectMapper,
        GraphStore graphStore,
        SimilarityIndex index,
        @Value("${beliefgraph.embedding.dimensions:768}") int expectedDimensions
    ) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = objectMapper;
        this.graphStore = graphStore;
        this.index = index;
        this.expectedDimensions = expectedDimensions;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS embeddings (
                node_id TEXT NOT NULL REFERENCES nodes(id),
                embedding_type TEXT NOT NULL,
                model TEXT NOT NULL,
                dimensions INTEGER NOT NULL,
                embedding_json TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                PRIMARY KEY (node_id, embedding_type)
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_embedding_type
            ON embeddings(embedding_type)
            """);

        int loaded = rebuildIndex();
        log.info("Initialized embedding store, {} vectors loaded into the similarity index", loaded);
    }

    /**
     * Store an embedding for a node and add it to the index. When called inside a
     * transaction the index is updated after commit, so a rollback leaves it untouched.
     *
     * @throws LookupException if the node does not exist
     * @throws ValidationException if the dimensions are wrong or the (node, type) key is already taken
     * @throws StorageException if the row cannot be written
     */
    public synchronized StoredEmbedding store(String nodeId, EmbeddingType type, float[] vector, String model) {
        if (graphStore.findNode(nodeId).isEmpty()) {
            throw new LookupException("Cannot embed missing node: " + nodeId);
        }
        if (vector == null || vector.length == 0) {
            throw new ValidationException("Embedding for node " + nodeId + " is empty");
        }
        if (expectedDimensions > 0 && vector.length != expectedDimensions) {
            throw new ValidationException(String.format(
                "Embedding for node %s has %d dimensions, expected %d", nodeId, vector.length, expectedDimensions));
        }
        if (getEmbedding(nodeId, type).isPresent()) {
            throw new ValidationException(String.format(
                "Node %s already has a %s embedding; embeddings are immutable", nodeId, type.getValue()));
        }

        Instant createdAt = Instant.ofEpochMilli(System.currentTimeMillis());
        try {
            String embeddingJson = objectMapper.writeValueAsString(vector);
            jdbcTemplate.update(
                "INSERT INTO embeddings (node_id, embedding_type, model, dimensions, embedding_json, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?)",
                nodeId, type.getValue(), model, vector.length, embeddingJson, createdAt.toEpochMilli()
            );
        } catch (JsonProcessingException | DataAccessException e) {
            throw new StorageException("Failed to store " + type.getValue() + " embedding for node " + nodeId, e);
        }

        float[] indexed = vector.clone();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    addToIndex(nodeId, type, indexed);
                }
            });
        } else {
            addToIndex(nodeId, type, indexed);
        }
        log.debug("Stored {} embedding for node {}", type.getValue(), nodeId);

        return StoredEmbedding.builder()
            .nodeId(nodeId)
            .embeddingType(type)
            .vector(vector.clone())
            .model(model)
            .dimensions(vector.length)
            .createdAt(createdAt)
            .build();
    }

    private synchronized void addToIndex(String nodeId, EmbeddingType type, float[] vector) {
        index.insert(nodeId, type, vector);
    }

    /**
     * Nodes whose embedding of this type scores at or above threshold, best first
     */
    public synchronized List<SimilarityMatch> findSimilar(float[] query, EmbeddingType type, double threshold, int limit) {
        return index.findSimilar(query, type, threshold, limit);
    }

    public Optional<StoredEmbedding> getEmbedding(String nodeId, EmbeddingType type) {
        List<StoredEmbedding> results = query(
            "SELECT * FROM embeddings WHERE node_id = ? AND embedding_type = ?",
            nodeId, type.getValue()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Every embedding stored for a node, any type
     */
    public List<StoredEmbedding> getEmbeddings(String nodeId) {
        return query("SELECT * FROM embeddings WHERE node_id = ? ORDER BY embedding_type", nodeId);
    }

    public List<StoredEmbedding> retrieveAll() {
        return query("SELECT * FROM embeddings ORDER BY created_at, rowid");
    }

    public int count(EmbeddingType type) {
        try {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM embeddings WHERE embedding_type = ?", Integer.class, type.getValue());
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count embeddings", e);
        }
    }

    /**
     * Clear the index and reload it from the embeddings table.
     *
     * @return Number of vectors loaded
     */
    public synchronized int rebuildIndex() {
        index.clear();
        List<StoredEmbedding> all = retrieveAll();
        for (StoredEmbedding embedding : all) {
            index.insert(embedding.getNodeId(), embedding.getEmbeddingType(), embedding.getVector());
        }
        log.debug("Rebuilt similarity index from {} stored embeddings", all.size());
        return all.size();
    }

    private List<StoredEmbedding> query(String sql, Object... args) {
        try {
            return jdbcTemplate.query(sql, new EmbeddingRowMapper(), args);
        } catch (DataAccessException e) {
            throw new StorageException("Embedding query failed", e);
        }
    }

    private class EmbeddingRowMapper implements RowMapper<StoredEmbedding> {
        @Override
        public StoredEmbedding mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                float[] vector = objectMapper.readValue(rs.getString("embedding_json"), float[].class);

                return StoredEmbedding.builder()
                    .nodeId(rs.getString("node_id"))
                    .embeddingType(EmbeddingType.fromValue(rs.getString("embedding_type")))
                    .model(rs.getString("model"))
                    .dimensions(rs.getInt("dimensions"))
                    .vector(vector)
                    .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
                    .build();
            } catch (IOException e) {
                throw new SQLException("Failed to deserialize embedding", e);
            }
        }
    }
}
