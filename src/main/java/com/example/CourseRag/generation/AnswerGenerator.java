package com.example.CourseRag.generation;

import com.example.CourseRag.model.ContentChunk;

import java.util.List;

/**
 * Generative tier of answer synthesis.
 */
public interface AnswerGenerator {

    String name();

    /**
     * False when generation is switched off by configuration; callers then skip straight to the
     * extractive summary.
     */
    default boolean enabled() {
        return true;
    }

    GenerationResult generate(String question, List<ContentChunk> chunks);
}
