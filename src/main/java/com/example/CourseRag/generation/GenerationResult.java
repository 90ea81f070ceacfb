package com.example.CourseRag.generation;

/**
 * Outcome of one generative call: the produced text or the reason there is none.
 */
public record GenerationResult(String text, Throwable error) {

    public static GenerationResult ok(String text) {
        return new GenerationResult(text, null);
    }

    public static GenerationResult failed(Throwable error) {
        return new GenerationResult(null, error);
    }

    public boolean isOk() {
        return text != null && !text.isBlank();
    }
}
