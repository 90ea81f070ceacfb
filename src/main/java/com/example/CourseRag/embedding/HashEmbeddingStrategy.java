package com.example.CourseRag.embedding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic stand-in for a real embedding model.
 *
 * The SHA-256 digest of the UTF-8 text is scaled byte-wise to [0,1] and repeated until the
 * vector has the configured dimension. Equal texts give equal vectors; the values carry no
 * semantic similarity.
 */
public class HashEmbeddingStrategy implements EmbeddingStrategy {

    public static final String NAME = "sha256-fallback";

    private final int dimension;

    public HashEmbeddingStrategy(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EmbeddingResult embed(String text) {
        return EmbeddingResult.ok(hashEmbed(text, dimension));
    }

    public int dimension() {
        return dimension;
    }

    public static float[] hashEmbed(String text, int dimension) {
        byte[] digest = sha256(text == null ? "" : text);
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = (digest[i % digest.length] & 0xFF) / 255.0f;
        }
        return vector;
    }

    private static byte[] sha256(String text) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
