package com.example.CourseRag.model;

import java.util.List;

/**
 * @param answer  Markdown answer
 * @param sources chunks used, in retrieval order
 * @param graph   concept context, null when unavailable
 */
public record ChatResponse(
        String answer,
        List<ContentChunk> sources,
        GraphContext graph
) {
}
