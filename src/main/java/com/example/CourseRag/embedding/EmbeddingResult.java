package com.example.CourseRag.embedding;

/**
 * Outcome of one embedding attempt: either a vector or the error that prevented it.
 */
public record EmbeddingResult(float[] vector, Throwable error) {

    public static EmbeddingResult ok(float[] vector) {
        return new EmbeddingResult(vector, null);
    }

    public static EmbeddingResult failed(Throwable error) {
        return new EmbeddingResult(null, error);
    }

    public boolean isOk() {
        return vector != null;
    }
}
