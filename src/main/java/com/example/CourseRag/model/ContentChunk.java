package com.example.CourseRag.model;

import java.util.UUID;

/**
 * A search hit joined with its persisted document and assignment.
 */
public record ContentChunk(
        UUID id,
        String assignmentTitle,
        String topic,
        String source,
        Integer chunkNumber,
        String content,
        double score
) {
}
