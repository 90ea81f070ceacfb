package com.example.CourseRag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide settings for the retrieval pipeline, bound from {@code rag.*}.
 */
@Data
@ConfigurationProperties(prefix = "rag")
public class RagProperties {

    private final Chat chat = new Chat();
    private final Embedding embedding = new Embedding();
    private final Qdrant qdrant = new Qdrant();
    private final Graph graph = new Graph();
    private final Generation generation = new Generation();
    private final Cors cors = new Cors();

    @Data
    public static class Chat {
        /** Chunk limit used when a request does not specify one. */
        private int defaultLimit = 6;
        private int minLimit = 1;
        private int maxLimit = 8;
        /** Sample questions shown by the web client. */
        private List<String> examplePrompts = new ArrayList<>(List.of(
                "Как подготовиться к пайплайну RAG для курса?",
                "Что включает граф знаний для тем по машинному обучению?",
                "Как лучше объяснить студенту векторное хранилище?"
        ));
    }

    @Data
    public static class Embedding {
        private EmbeddingStrategyType strategy = EmbeddingStrategyType.FALLBACK;
        private int dimension = 384;
    }

    @Data
    public static class Qdrant {
        private String url = "http://localhost:6333";
        private String apiKey = "";
        private String collection = "course_materials";
        /** Optional similarity cut-off passed to the index; null disables it. */
        private Double scoreThreshold;
        private Duration timeout = Duration.ofSeconds(3);
        private boolean verifyOnStartup = true;
    }

    @Data
    public static class Graph {
        private boolean enabled = true;
        private String database = "neo4j";
        private int maxEdges = 40;
        private int maxAssignmentsPerTopic = 3;
        private Duration timeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Generation {
        private SynthesisMode mode = SynthesisMode.EXTRACTIVE;
        /** deepseek or openai; the other one is used if the preferred model is missing. */
        private String provider = "deepseek";
        private double temperature = 0.2;
        private int maxTokens = 600;
        private int chunkCharBudget = 600;
    }

    @Data
    public static class Cors {
        /** Origins allowed to call /api/** and /healthz from a browser; "*" allows any. */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    public enum EmbeddingStrategyType {
        FALLBACK,
        MODEL
    }

    public enum SynthesisMode {
        EXTRACTIVE,
        GENERATIVE
    }
}
