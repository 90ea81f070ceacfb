package com.example.CourseRag.model;

import java.util.UUID;

/**
 * A document row joined with its assignment.
 */
public record MaterialRecord(
        UUID id,
        String content,
        String source,
        Integer chunkNumber,
        String assignmentTitle,
        String topic
) {
    public ContentChunk toChunk(double score) {
        return new ContentChunk(id, assignmentTitle, topic, source, chunkNumber, content, score);
    }
}
