package com.example.CourseRag.model;

import java.util.List;

/**
 * Concept neighbourhood of the topics found in a response. Nodes are unique by topic id.
 */
public record GraphContext(
        List<ConceptNode> nodes,
        List<ConceptEdge> edges
) {
}
