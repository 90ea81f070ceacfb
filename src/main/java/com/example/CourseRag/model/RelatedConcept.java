package com.example.CourseRag.model;

/**
 * One RELATES_TO row read from the graph store.
 */
public record RelatedConcept(
        String sourceId,
        String sourceLabel,
        String targetId,
        String targetLabel
) {
}
