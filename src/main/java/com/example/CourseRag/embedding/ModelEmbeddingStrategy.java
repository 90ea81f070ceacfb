package com.example.CourseRag.embedding;

import com.example.CourseRag.util.BackendHandle;
import com.example.CourseRag.util.OneTimeWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.Optional;

/**
 * Embeds text with the configured Spring AI embedding model.
 * The model's native vector is returned as-is even when its size differs from the
 * configured dimension; the mismatch is reported once.
 */
public class ModelEmbeddingStrategy implements EmbeddingStrategy {

    public static final String NAME = "embedding-model";

    private static final Logger log = LoggerFactory.getLogger(ModelEmbeddingStrategy.class);

    private final BackendHandle<EmbeddingModel> model;
    private final int configuredDimension;
    private final OneTimeWarnings warnings = new OneTimeWarnings(log);

    public ModelEmbeddingStrategy(BackendHandle<EmbeddingModel> model, int configuredDimension) {
        this.model = model;
        this.configuredDimension = configuredDimension;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EmbeddingResult embed(String text) {
        Optional<EmbeddingModel> embeddingModel = model.get();
        if (embeddingModel.isEmpty()) {
            return EmbeddingResult.failed(new IllegalStateException("No embedding model is available"));
        }
        try {
            float[] vector = embeddingModel.get().embed(text);
            if (vector == null || vector.length == 0) {
                return EmbeddingResult.failed(new IllegalStateException("Embedding model returned an empty vector"));
            }
            if (vector.length != configuredDimension) {
                warnings.warn("dimension",
                        "Embedding model returns {} dimensions but rag.embedding.dimension is {}",
                        vector.length, configuredDimension);
            }
            return EmbeddingResult.ok(vector);
        } catch (RuntimeException e) {
            return EmbeddingResult.failed(e);
        }
    }
}
