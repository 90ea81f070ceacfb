package com.example.CourseRag.model;

public record ConceptEdge(
        String sourceTopicId,
        String targetTopicId
) {
}
