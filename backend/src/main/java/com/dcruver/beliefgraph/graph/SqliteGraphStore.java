package com.dcruver.beliefgraph.graph;

import com.dcruver.beliefgraph.domain.BeliefDetails;
import com.dcruver.beliefgraph.domain.Direction;
import com.dcruver.beliefgraph.domain.Edge;
import com.dcruver.beliefgraph.domain.EdgeProperties;
import com.dcruver.beliefgraph.domain.EdgeProperty;
import com.dcruver.beliefgraph.domain.EdgeType;
import com.dcruver.beliefgraph.domain.ModuleDetails;
import com.dcruver.beliefgraph.domain.ModuleIntentions;
import com.dcruver.beliefgraph.domain.ModuleTree;
import com.dcruver.beliefgraph.domain.Node;
import com.dcruver.beliefgraph.domain.NodeDetails;
import com.dcruver.beliefgraph.domain.NodePurpose;
import com.dcruver.beliefgraph.domain.NodeSource;
import com.dcruver.beliefgraph.domain.NodeStatus;
import com.dcruver.beliefgraph.domain.NodeVariant;
import com.dcruver.beliefgraph.domain.OrganizationDetails;
import com.dcruver.beliefgraph.domain.OrganizationType;
import com.dcruver.beliefgraph.domain.Provenance;
import com.dcruver.beliefgraph.domain.RelatedNode;
import com.dcruver.beliefgraph.domain.SourceType;
import com.dcruver.beliefgraph.domain.Valence;
import com.dcruver.beliefgraph.exception.LookupException;
import com.dcruver.beliefgraph.exception.StorageException;
import com.dcruver.beliefgraph.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * SQLite-backed {@link GraphStore}. One base table for nodes, one payload table per
 * variant family and one edge table; payload rows share the node's id.
 */
@Component
@Slf4j
public class SqliteGraphStore implements GraphStore {

    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};

    private static final String NODE_SELECT = """
        SELECT n.id, n.variant, n.title, n.content, n.created_at, n.updated_at,
               m.intentions_json, m.priority, m.research_depth, m.active, m.declared_at,
               b.status, b.source, b.confidence AS belief_confidence, b.purpose, b.source_type, b.valence,
               b.valid_from AS belief_valid_from, b.valid_to AS belief_valid_to,
               b.recorded_at, b.suggested_at, b.structured_data_json,
               b.session_id, b.message_index, b.source_char_start, b.source_char_end, b.source_file,
               o.type AS org_type, o.confidence AS org_confidence,
               o.valid_from AS org_valid_from, o.valid_to AS org_valid_to
        FROM nodes n
        LEFT JOIN module_details m ON m.node_id = n.id
        LEFT JOIN belief_details b ON b.node_id = n.id
        LEFT JOIN organization_details o ON o.node_id = n.id
        """;

    private static final String EDGE_SELECT = """
        SELECT e.id, e.type, e.from_id, e.to_id, e.status, e.confidence, e.rationale, e.created_at,
               f.variant AS from_variant, t.variant AS to_variant
        FROM edges e
        JOIN nodes f ON f.id = e.from_id
        JOIN nodes t ON t.id = e.to_id
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Node> nodeRowMapper = new NodeRowMapper();
    private final RowMapper<Edge> edgeRowMapper = new EdgeRowMapper();

    public SqliteGraphStore(DataSource dataSource, ObjectMapper objectMapper) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS nodes (
                id TEXT PRIMARY KEY,
                variant TEXT NOT NULL,
                title TEXT NOT NULL,
                content TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS module_details (
                node_id TEXT PRIMARY KEY REFERENCES nodes(id),
                intentions_json TEXT,
                priority INTEGER NOT NULL,
                research_depth INTEGER NOT NULL,
                active INTEGER NOT NULL,
                declared_at INTEGER
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS belief_details (
                node_id TEXT PRIMARY KEY REFERENCES nodes(id),
                status TEXT NOT NULL,
                source TEXT,
                confidence REAL NOT NULL,
                purpose TEXT,
                source_type TEXT,
                valence TEXT,
                valid_from INTEGER,
                valid_to INTEGER,
                recorded_at INTEGER NOT NULL,
                suggested_at INTEGER,
                structured_data_json TEXT,
                session_id TEXT,
                message_index INTEGER,
                source_char_start INTEGER,
                source_char_end INTEGER,
                source_file TEXT
            )
            """);

        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_belief_session
            ON belief_details(session_id, message_index)
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS organization_details (
                node_id TEXT PRIMARY KEY REFERENCES nodes(id),
                type TEXT NOT NULL,
                confidence REAL,
                valid_from INTEGER,
                valid_to INTEGER
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS edges (
                id TEXT PRIMARY KEY,
                type TEXT NOT NULL,
                from_id TEXT NOT NULL REFERENCES nodes(id),
                to_id TEXT NOT NULL REFERENCES nodes(id),
                status TEXT,
                confidence REAL,
                rationale TEXT,
                created_at INTEGER NOT NULL
            )
            """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_edges_from ON edges(from_id, type)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_edges_to ON edges(to_id, type)");

        log.info("Initialized graph store");
    }

    // =========================================================================
    // Nodes
    // =========================================================================

    @Override
    public Node createNode(NodeVariant variant, String title, String content, NodeDetails details) {
        if (variant == null || details == null) {
            throw new ValidationException("Node variant and details are required");
        }
        if (title == null) {
            throw new ValidationException("Node title is required");
        }

        Instant now = now();
        NodeDetails payload = preparePayload(variant, details, now);
        Node node = Node.builder()
            .id(UUID.randomUUID().toString())
            .title(title)
            .content(content == null ? "" : content)
            .createdAt(now)
            .updatedAt(now)
            .details(payload)
            .build();

        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update(
                    "INSERT INTO nodes (id, variant, title, content, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?)",
                    node.getId(), variant.name(), node.getTitle(), node.getContent(),
                    now.toEpochMilli(), now.toEpochMilli());
                insertPayload(node.getId(), payload);
            });
        } catch (DataAccessException e) {
            throw new StorageException("Failed to store " + variant + " node '" + title + "'", e);
        }

        log.debug("Created {} node {} ({})", variant, node.getId(), title);
        return node;
    }

    private NodeDetails preparePayload(NodeVariant variant, NodeDetails details, Instant now) {
        if (details instanceof BeliefDetails belief) {
            if (belief.getVariant() == null
                && (variant == NodeVariant.LEAF || variant == NodeVariant.INTERNAL)) {
                belief = belief.withVariant(variant);
            }
            requireVariant(variant, belief);
            if (belief.getStatus() == null) {
                throw new ValidationException(variant + " node status is required");
            }
            requireConfidence(belief.getConfidence());
            if (belief.getRecordedAt() == null) {
                belief = belief.withRecordedAt(now);
            }
            return belief;
        }

        requireVariant(variant, details);
        if (details instanceof OrganizationDetails organization) {
            if (organization.getType() == null) {
                throw new ValidationException("Organization node type is required");
            }
            if (organization.getConfidence() != null) {
                requireConfidence(organization.getConfidence());
            }
        }
        if (details instanceof ModuleDetails module) {
            if (module.getResearchDepth() < 0 || module.getResearchDepth() > 10) {
                throw new ValidationException("Research depth must be between 0 and 10: " + module.getResearchDepth());
            }
        }
        return details;
    }

    private static void requireVariant(NodeVariant variant, NodeDetails details) {
        if (details.getVariant() != variant) {
            throw new ValidationException(String.format(
                "%s details cannot be stored on a %s node", details.getVariant(), variant));
        }
    }

    private static void requireConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("Confidence must be between 0 and 1: " + confidence);
        }
    }

    private void insertPayload(String nodeId, NodeDetails payload) {
        if (payload instanceof ModuleDetails module) {
            jdbcTemplate.update(
                "INSERT INTO module_details (node_id, intentions_json, priority, research_depth, active, declared_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?)",
                nodeId, toJson(module.getIntentions()), module.getPriority(), module.getResearchDepth(),
                module.isActive() ? 1 : 0, millis(module.getDeclaredAt()));
        } else if (payload instanceof BeliefDetails belief) {
            Provenance provenance = belief.getProvenance();
            jdbcTemplate.update("""
                    INSERT INTO belief_details (node_id, status, source, confidence, purpose, source_type, valence,
                        valid_from, valid_to, recorded_at, suggested_at, structured_data_json,
                        session_id, message_index, source_char_start, source_char_end, source_file)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                nodeId,
                belief.getStatus().getValue(),
                belief.getSource() == null ? null : belief.getSource().getValue(),
                belief.getConfidence(),
                belief.getPurpose() == null ? null : belief.getPurpose().getValue(),
                belief.getSourceType() == null ? null : belief.getSourceType().getValue(),
                belief.getValence() == null ? null : belief.getValence().getValue(),
                millis(belief.getValidFrom()),
                millis(belief.getValidTo()),
                millis(belief.getRecordedAt()),
                millis(belief.getSuggestedAt()),
                belief.getStructuredData() == null || belief.getStructuredData().isEmpty()
                    ? null : toJson(belief.getStructuredData()),
                provenance == null ? null : provenance.getSessionId(),
                provenance == null ? null : provenance.getMessageIndex(),
                provenance == null ? null : provenance.getSourceCharStart(),
                provenance == null ? null : provenance.getSourceCharEnd(),
                provenance == null ? null : provenance.getSourceFile());
        } else if (payload instanceof OrganizationDetails organization) {
            jdbcTemplate.update(
                "INSERT INTO organization_details (node_id, type, confidence, valid_from, valid_to) VALUES (?, ?, ?, ?, ?)",
                nodeId, organization.getType().getValue(), organization.getConfidence(),
                millis(organization.getValidFrom()), millis(organization.getValidTo()));
        } else {
            throw new ValidationException("Unsupported node details: " + payload.getClass().getSimpleName());
        }
    }

    @Override
    public Node getNode(String nodeId) {
        return findNode(nodeId).orElseThrow(() -> new LookupException("Node not found: " + nodeId));
    }

    @Override
    public Optional<Node> findNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        List<Node> results = query(NODE_SELECT + " WHERE n.id = ?", nodeRowMapper, nodeId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Node updateStatus(String nodeId, NodeStatus status) {
        Node node = getNode(nodeId);
        if (!(node.getDetails() instanceof BeliefDetails)) {
            throw new ValidationException(node.getVariant() + " nodes do not carry a status");
        }
        if (status == null) {
            throw new ValidationException("Status is required");
        }

        Instant now = now();
        try {
            transactionTemplate.executeWithoutResult(tx -> {
                jdbcTemplate.update("UPDATE belief_details SET status = ? WHERE node_id = ?",
                    status.getValue(), nodeId);
                jdbcTemplate.update("UPDATE nodes SET updated_at = ? WHERE id = ?",
                    now.toEpochMilli(), nodeId);
            });
        } catch (DataAccessException e) {
            throw new StorageException("Failed to update status of node " + nodeId, e);
        }

        log.info("Node {} status {} -> {}", nodeId, node.asBelief().getStatus().getValue(), status.getValue());
        return getNode(nodeId);
    }

    @Override
    public List<Node> findBySession(String sessionId) {
        return query(NODE_SELECT + " WHERE b.session_id = ? ORDER BY b.message_index, n.created_at",
            nodeRowMapper, sessionId);
    }

    @Override
    public List<Node> findByTimeRange(Instant start, Instant end) {
        return query(NODE_SELECT + " WHERE n.variant <> 'ORGANIZATION' AND n.created_at >= ? AND n.created_at <= ?"
                + " ORDER BY n.created_at",
            nodeRowMapper, start.toEpochMilli(), end.toEpochMilli());
    }

    @Override
    public int countNodes(NodeVariant variant) {
        try {
            Integer count = variant == null
                ? jdbcTemplate.queryForObject("SELECT COUNT(*) FROM nodes", Integer.class)
                : jdbcTemplate.queryForObject("SELECT COUNT(*) FROM nodes WHERE variant = ?", Integer.class,
                    variant.name());
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count nodes", e);
        }
    }

    // =========================================================================
    // Edges
    // =========================================================================

    @Override
    public Edge createEdge(String fromId, String toId, String type, EdgeProperties properties) {
        EdgeType edgeType = EdgeType.parse(type)
            .orElseThrow(() -> new ValidationException("Unknown edge type: " + type));
        return createEdge(fromId, toId, edgeType, properties);
    }

    @Override
    public Edge createEdge(String fromId, String toId, EdgeType type, EdgeProperties properties) {
        if (type == null) {
            throw new ValidationException("Edge type is required");
        }
        EdgeProperties props = properties == null ? EdgeProperties.none() : properties;

        Node from = getNode(fromId);
        Node to = getNode(toId);

        if (!EdgeConstraints.isPermitted(type, from.getVariant(), to.getVariant())) {
            throw new ValidationException(String.format(
                "%s edge cannot be created from %s to %s (permitted: %s)",
                type, from.getVariant(), to.getVariant(), EdgeConstraints.permittedPairs(type)));
        }

        requireCarried(type, EdgeProperty.STATUS, props.getStatus());
        requireCarried(type, EdgeProperty.CONFIDENCE, props.getConfidence());
        requireCarried(type, EdgeProperty.RATIONALE, props.getRationale());
        if (props.getConfidence() != null) {
            requireConfidence(props.getConfidence());
        }

        Instant now = now();
        Edge edge = Edge.builder()
            .id(UUID.randomUUID().toString())
            .type(type)
            .fromId(fromId)
            .toId(toId)
            .fromVariant(from.getVariant())
            .toVariant(to.getVariant())
            .status(type.carries(EdgeProperty.STATUS)
                ? Optional.ofNullable(props.getStatus()).orElse(NodeStatus.CONFIRMED) : null)
            .confidence(type.carries(EdgeProperty.CONFIDENCE)
                ? Optional.ofNullable(props.getConfidence()).orElse(1.0) : null)
            .rationale(props.getRationale())
            .createdAt(now)
            .build();

        try {
            jdbcTemplate.update(
                "INSERT INTO edges (id, type, from_id, to_id, status, confidence, rationale, created_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                edge.getId(), type.name(), fromId, toId,
                edge.getStatus() == null ? null : edge.getStatus().getValue(),
                edge.getConfidence(), edge.getRationale(), now.toEpochMilli());
        } catch (DataAccessException e) {
            throw new StorageException("Failed to store " + type + " edge " + fromId + " -> " + toId, e);
        }

        log.debug("Created {} edge {} -> {}", type, fromId, toId);
        return edge;
    }

    private static void requireCarried(EdgeType type, EdgeProperty property, Object value) {
        if (value != null && !type.carries(property)) {
            throw new ValidationException(String.format(
                "%s edges do not carry %s", type, property.name().toLowerCase()));
        }
    }

    @Override
    public List<Edge> getEdges(String nodeId) {
        getNode(nodeId);
        return query(EDGE_SELECT + " WHERE e.from_id = ? OR e.to_id = ? ORDER BY e.created_at, e.rowid",
            edgeRowMapper, nodeId, nodeId);
    }

    // =========================================================================
    // Traversal
    // =========================================================================

    @Override
    public List<Node> getChildren(String nodeId) {
        Node parent = getNode(nodeId);
        if (!parent.getVariant().isContainer()) {
            return List.of();
        }
        return query(NODE_SELECT + """
                 JOIN edges e ON e.to_id = n.id
                WHERE e.from_id = ? AND e.type = 'CONTAINS' AND n.variant <> 'ORGANIZATION'
                ORDER BY e.created_at, e.rowid
                """,
            nodeRowMapper, nodeId);
    }

    @Override
    public List<RelatedNode> getRelated(String nodeId) {
        return related(nodeId, EdgeType.RELATIONSHIP_TYPES, false);
    }

    @Override
    public List<RelatedNode> getRelated(String nodeId, EdgeType type) {
        if (type == null) {
            return getRelated(nodeId);
        }
        return related(nodeId, Set.of(type), type == EdgeType.REFERENCES);
    }

    private List<RelatedNode> related(String nodeId, Set<EdgeType> types, boolean includeOrganization) {
        getNode(nodeId);

        String placeholders = types.stream().map(t -> "?").collect(Collectors.joining(", "));
        List<Object> args = new ArrayList<>();
        args.add(nodeId);
        args.add(nodeId);
        types.stream().map(EdgeType::name).forEach(args::add);

        List<Edge> edges = query(EDGE_SELECT
                + " WHERE (e.from_id = ? OR e.to_id = ?) AND e.type IN (" + placeholders + ")"
                + " ORDER BY e.created_at, e.rowid",
            edgeRowMapper, args.toArray());

        List<RelatedNode> related = new ArrayList<>();
        for (Edge edge : edges) {
            Direction direction = edge.getFromId().equals(nodeId) ? Direction.OUTGOING : Direction.INCOMING;
            Node other = getNode(edge.otherEnd(nodeId));
            if (other.getVariant() == NodeVariant.ORGANIZATION && !includeOrganization) {
                continue;
            }
            related.add(new RelatedNode(other, edge, direction));
        }
        return related;
    }

    @Override
    public ModuleTree getModuleTree(String rootId, int maxDepth) {
        return subtree(getNode(rootId), 0, Math.max(0, maxDepth), new HashSet<>());
    }

    private ModuleTree subtree(Node node, int depth, int maxDepth, Set<String> path) {
        if (depth >= maxDepth || !path.add(node.getId())) {
            return new ModuleTree(node, List.of());
        }
        List<ModuleTree> children = new ArrayList<>();
        for (Node child : getChildren(node.getId())) {
            if (!path.contains(child.getId())) {
                children.add(subtree(child, depth + 1, maxDepth, path));
            }
        }
        path.remove(node.getId());
        return new ModuleTree(node, Collections.unmodifiableList(children));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private <T> List<T> query(String sql, RowMapper<T> mapper, Object... args) {
        try {
            return jdbcTemplate.query(sql, mapper, args);
        } catch (DataAccessException e) {
            throw new StorageException("Graph query failed", e);
        }
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static Instant now() {
        return Instant.ofEpochMilli(System.currentTimeMillis());
    }

    private static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static Integer integer(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double decimal(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Maps a {@link #NODE_SELECT} row to a node with the payload matching its variant
     */
    private class NodeRowMapper implements RowMapper<Node> {
        @Override
        public Node mapRow(ResultSet rs, int rowNum) throws SQLException {
            NodeVariant variant = NodeVariant.valueOf(rs.getString("variant"));
            return Node.builder()
                .id(rs.getString("id"))
                .title(rs.getString("title"))
                .content(rs.getString("content"))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .details(switch (variant) {
                    case MODULE -> mapModule(rs);
                    case LEAF, INTERNAL -> mapBelief(rs, variant);
                    case ORGANIZATION -> mapOrganization(rs);
                })
                .build();
        }

        private ModuleDetails mapModule(ResultSet rs) throws SQLException {
            String intentionsJson = rs.getString("intentions_json");
            ModuleIntentions intentions = null;
            if (intentionsJson != null) {
                try {
                    intentions = objectMapper.readValue(intentionsJson, ModuleIntentions.class);
                } catch (JsonProcessingException e) {
                    throw new SQLException("Failed to deserialize module intentions", e);
                }
            }
            return ModuleDetails.builder()
                .intentions(intentions)
                .priority(rs.getInt("priority"))
                .researchDepth(rs.getInt("research_depth"))
                .active(rs.getInt("active") != 0)
                .declaredAt(instant(rs, "declared_at"))
                .build();
        }

        private BeliefDetails mapBelief(ResultSet rs, NodeVariant variant) throws SQLException {
            String structuredJson = rs.getString("structured_data_json");
            Map<String, Object> structuredData = null;
            if (structuredJson != null) {
                try {
                    structuredData = objectMapper.readValue(structuredJson, JSON_MAP);
                } catch (JsonProcessingException e) {
                    throw new SQLException("Failed to deserialize structured data", e);
                }
            }

            String sessionId = rs.getString("session_id");
            Integer messageIndex = integer(rs, "message_index");
            String sourceFile = rs.getString("source_file");
            Provenance provenance = null;
            if (sessionId != null || messageIndex != null || sourceFile != null) {
                provenance = Provenance.builder()
                    .sessionId(sessionId)
                    .messageIndex(messageIndex)
                    .sourceCharStart(integer(rs, "source_char_start"))
                    .sourceCharEnd(integer(rs, "source_char_end"))
                    .sourceFile(sourceFile)
                    .build();
            }

            String source = rs.getString("source");
            String purpose = rs.getString("purpose");
            String sourceType = rs.getString("source_type");
            return BeliefDetails.builder()
                .variant(variant)
                .status(NodeStatus.fromValue(rs.getString("status")))
                .source(NodeSource.fromValue(source))
                .confidence(rs.getDouble("belief_confidence"))
                .purpose(purpose == null ? null : NodePurpose.fromValue(purpose))
                .sourceType(sourceType == null ? null : SourceType.fromValue(sourceType))
                .valence(Valence.fromValue(rs.getString("valence")))
                .validFrom(instant(rs, "belief_valid_from"))
                .validTo(instant(rs, "belief_valid_to"))
                .recordedAt(instant(rs, "recorded_at"))
                .suggestedAt(instant(rs, "suggested_at"))
                .structuredData(structuredData)
                .provenance(provenance)
                .build();
        }

        private OrganizationDetails mapOrganization(ResultSet rs) throws SQLException {
            return OrganizationDetails.builder()
                .type(OrganizationType.fromValue(rs.getString("org_type")))
                .confidence(decimal(rs, "org_confidence"))
                .validFrom(instant(rs, "org_valid_from"))
                .validTo(instant(rs, "org_valid_to"))
                .build();
        }
    }

    private static class EdgeRowMapper implements RowMapper<Edge> {
        @Override
        public Edge mapRow(ResultSet rs, int rowNum) throws SQLException {
            String status = rs.getString("status");
            return Edge.builder()
                .id(rs.getString("id"))
                .type(EdgeType.valueOf(rs.getString("type")))
                .fromId(rs.getString("from_id"))
                .toId(rs.getString("to_id"))
                .fromVariant(NodeVariant.valueOf(rs.getString("from_variant")))
                .toVariant(NodeVariant.valueOf(rs.getString("to_variant")))
                .status(status == null ? null : NodeStatus.fromValue(status))
                .confidence(decimal(rs, "confidence"))
                .rationale(rs.getString("rationale"))
                .createdAt(instant(rs, "created_at"))
                .build();
        }
    }
}
