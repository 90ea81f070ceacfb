package com.example.CourseRag.model;

/**
 * One nearest-neighbour hit from the vector index.
 * documentId is the raw payload value; it is parsed during hydration.
 */
public record Candidate(
        String pointId,
        String documentId,
        double score,
        String topic,
        String source
) {
}
