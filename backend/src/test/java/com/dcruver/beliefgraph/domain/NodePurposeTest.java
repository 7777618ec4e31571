package com.dcruver.beliefgraph.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodePurposeTest {

    @Test
    void testKnownPurposesParseCaseInsensitively() {
        assertEquals(NodePurpose.PATTERN, NodePurpose.fromValue("pattern"));
        assertEquals(NodePurpose.DECISION, NodePurpose.fromValue(" Decision "));
        assertEquals("intention", NodePurpose.INTENTION.getValue());
    }

    @Test
    void testUnknownPurposeCoercesToObservation() {
        assertEquals(NodePurpose.OBSERVATION, NodePurpose.fromValue("feeling"));
        assertEquals(NodePurpose.OBSERVATION, NodePurpose.fromValue(null));
    }

    @Test
    void testEdgeTypeParsing() {
        assertEquals(EdgeType.SUPPORTS, EdgeType.parse("supports").orElseThrow());
        assertTrue(EdgeType.parse("LIKES").isEmpty());
        assertTrue(EdgeType.RELATIONSHIP_TYPES.contains(EdgeType.SIMILAR_TO));
        assertFalse(EdgeType.RELATIONSHIP_TYPES.contains(EdgeType.CONTAINS));
        assertFalse(EdgeType.SUPERSEDES.carries(EdgeProperty.CONFIDENCE));
    }
}
