package com.example.CourseRag.config;

import com.example.CourseRag.exception.VectorSearchException;
import com.example.CourseRag.repository.CourseVectorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Checks at startup that the Qdrant collection vectors match rag.embedding.dimension.
 * A mismatch stops the application; an unreachable index is only reported.
 */
@Component
@ConditionalOnProperty(prefix = "rag.qdrant", name = "verify-on-startup", havingValue = "true", matchIfMissing = true)
public class VectorCollectionVerifier implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(VectorCollectionVerifier.class);

    private final CourseVectorRepository vectorRepository;
    private final int expectedDimension;

    public VectorCollectionVerifier(CourseVectorRepository vectorRepository, RagProperties properties) {
        this.vectorRepository = vectorRepository;
        this.expectedDimension = properties.getEmbedding().getDimension();
    }

    @Override
    public void run(ApplicationArguments args) {
        OptionalInt size;
        try {
            size = vectorRepository.describeVectorSize();
        } catch (VectorSearchException e) {
            log.warn("Could not verify Qdrant collection '{}': {}", vectorRepository.collection(), e.getMessage());
            return;
        }
        if (size.isEmpty()) {
            log.warn("Qdrant collection '{}' does not report a single vector size; skipping dimension check",
                    vectorRepository.collection());
            return;
        }
        if (size.getAsInt() != expectedDimension) {
            throw new IllegalStateException("Qdrant collection '" + vectorRepository.collection()
                    + "' stores " + size.getAsInt() + "-dimensional vectors but rag.embedding.dimension is "
                    + expectedDimension);
        }
        log.info("Qdrant collection '{}' uses {}-dimensional vectors", vectorRepository.collection(), expectedDimension);
    }
}
