package com.example.CourseRag.generation;

import com.example.CourseRag.model.ContentChunk;

import java.util.List;

/**
 * Used when {@code rag.generation.mode=EXTRACTIVE}.
 */
public class DisabledAnswerGenerator implements AnswerGenerator {

    @Override
    public String name() {
        return "disabled";
    }

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public GenerationResult generate(String question, List<ContentChunk> chunks) {
        return GenerationResult.failed(new IllegalStateException("Generative answers are disabled"));
    }
}
