package com.dcruver.beliefgraph.graph;

import com.dcruver.beliefgraph.domain.BeliefDetails;
import com.dcruver.beliefgraph.domain.Edge;
import com.dcruver.beliefgraph.domain.EdgeProperties;
import com.dcruver.beliefgraph.domain.EdgeType;
import com.dcruver.beliefgraph.domain.ModuleDetails;
import com.dcruver.beliefgraph.domain.ModuleIntentions;
import com.dcruver.beliefgraph.domain.ModuleTree;
import com.dcruver.beliefgraph.domain.Node;
import com.dcruver.beliefgraph.domain.NodeDetails;
import com.dcruver.beliefgraph.domain.NodeStatus;
import com.dcruver.beliefgraph.domain.NodeVariant;
import com.dcruver.beliefgraph.domain.OrganizationDetails;
import com.dcruver.beliefgraph.domain.RelatedNode;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Typed node and edge storage for the belief graph.
 *
 * <p>Nodes are never deleted; lifecycle changes go through {@link #updateStatus}
 * and SUPERSEDES edges. Every edge write is checked against {@link EdgeConstraints}
 * before anything is persisted.
 */
public interface GraphStore {

    // =========================================================================
    // Node Operations
    // =========================================================================

    /**
     * Create a node with a generated id and timestamps.
     *
     * @param variant Variant of the node; must match the payload
     * @param title   Short title or slug
     * @param content Full text
     * @param details Variant payload
     * @return The stored node
     * @throws com.dcruver.beliefgraph.exception.ValidationException if the payload does not
     *         match the variant or a confidence is outside [0,1]
     */
    Node createNode(NodeVariant variant, String title, String content, NodeDetails details);

    /**
     * Get a node by id, including organization nodes.
     *
     * @throws com.dcruver.beliefgraph.exception.LookupException if no such node exists
     */
    Node getNode(String nodeId);

    Optional<Node> findNode(String nodeId);

    /**
     * Set the lifecycle status of an INTERNAL or LEAF node.
     *
     * @return The updated node
     */
    Node updateStatus(String nodeId, NodeStatus status);

    /**
     * Belief nodes extracted from one conversation session, in message order.
     */
    List<Node> findBySession(String sessionId);

    /**
     * User-space nodes created within [start, end], oldest first.
     */
    List<Node> findByTimeRange(Instant start, Instant end);

    int countNodes(NodeVariant variant);

    default Node createModule(String title, String content, ModuleIntentions intentions,
                              int priority, int researchDepth) {
        return createNode(NodeVariant.MODULE, title, content, ModuleDetails.builder()
            .intentions(intentions)
            .priority(priority)
            .researchDepth(researchDepth)
            .build());
    }

    default Node createLeaf(String title, String content, BeliefDetails details) {
        return createNode(NodeVariant.LEAF, title, content, details);
    }

    default Node createInternal(String title, String content, BeliefDetails details) {
        return createNode(NodeVariant.INTERNAL, title, content, details);
    }

    default Node createOrganization(String title, String content, OrganizationDetails details) {
        return createNode(NodeVariant.ORGANIZATION, title, content, details);
    }

    // =========================================================================
    // Edge Operations
    // =========================================================================

    /**
     * Create an edge after checking the type, the endpoint variant pair and the properties.
     *
     * @throws com.dcruver.beliefgraph.exception.LookupException if either endpoint is missing
     * @throws com.dcruver.beliefgraph.exception.ValidationException if the pair or a property is not allowed
     */
    Edge createEdge(String fromId, String toId, EdgeType type, EdgeProperties properties);

    /**
     * String form for callers holding an untyped edge name.
     *
     * @throws com.dcruver.beliefgraph.exception.ValidationException if the type is unknown
     */
    Edge createEdge(String fromId, String toId, String type, EdgeProperties properties);

    /**
     * All edges touching a node, any type, oldest first.
     */
    List<Edge> getEdges(String nodeId);

    // =========================================================================
    // Traversal
    // =========================================================================

    /**
     * Nodes this node CONTAINS. Empty for LEAF and ORGANIZATION nodes.
     */
    List<Node> getChildren(String nodeId);

    /**
     * Nodes linked through the semantic relationship edges (SUPPORTS, CONTRADICTS,
     * ENABLES, SUPERSEDES, SIMILAR_TO) in either direction.
     */
    List<RelatedNode> getRelated(String nodeId);

    /**
     * Nodes linked through one edge type in either direction.
     */
    List<RelatedNode> getRelated(String nodeId, EdgeType type);

    default List<Node> findContradictions(String nodeId) {
        return getRelated(nodeId, EdgeType.CONTRADICTS).stream()
            .map(RelatedNode::getNode)
            .toList();
    }

    /**
     * CONTAINS hierarchy under a node down to maxDepth levels.
     */
    ModuleTree getModuleTree(String rootId, int maxDepth);
}
