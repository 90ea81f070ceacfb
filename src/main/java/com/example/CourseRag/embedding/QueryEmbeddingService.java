package com.example.CourseRag.embedding;

import com.example.CourseRag.util.OneTimeWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a question into a query vector.
 *
 * Asks the configured strategy first and switches to the hash fallback when it reports an
 * error, so embedding never fails a request. Fallback use is logged once per strategy name.
 */
@Service
public class QueryEmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(QueryEmbeddingService.class);

    private final EmbeddingStrategy strategy;
    private final HashEmbeddingStrategy fallback;
    private final OneTimeWarnings warnings = new OneTimeWarnings(log);

    public QueryEmbeddingService(EmbeddingStrategy strategy, HashEmbeddingStrategy fallback) {
        this.strategy = strategy;
        this.fallback = fallback;
    }

    public float[] embed(String text) {
        EmbeddingResult result = strategy.embed(text);
        if (result.isOk()) {
            return result.vector();
        }
        warnings.warn(strategy.name(),
                "Embedding strategy '{}' failed ({}); using deterministic fallback '{}'",
                strategy.name(), describe(result.error()), fallback.name());
        return fallback.embed(text).vector();
    }

    public String activeStrategy() {
        return strategy.name();
    }

    private static String describe(Throwable error) {
        return error == null ? "unknown error" : error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
