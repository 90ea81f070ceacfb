package com.example.CourseRag.embedding;

/**
 * Maps text to a query vector. Implementations report failures through
 * {@link EmbeddingResult} instead of throwing.
 */
public interface EmbeddingStrategy {

    String name();

    EmbeddingResult embed(String text);
}
