package com.example.CourseRag.model;

/**
 * Body of {@code POST /api/chat}.
 *
 * @param message user question
 * @param limit   optional number of context chunks to return, 1..8
 */
public record ChatRequest(
        String message,
        Integer limit
) {
}
