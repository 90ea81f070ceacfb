package com.example.CourseRag.repository;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.exception.VectorSearchException;
import com.example.CourseRag.model.Candidate;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Nearest-neighbour search against one Qdrant collection over its REST API.
 */
@Repository
public class CourseVectorRepository {

    private static final Logger log = LoggerFactory.getLogger(CourseVectorRepository.class);

    private final RestClient restClient;
    private final String collection;
    private final Double scoreThreshold;

    public CourseVectorRepository(@Qualifier("qdrantRestClient") RestClient restClient, RagProperties properties) {
        this.restClient = restClient;
        this.collection = properties.getQdrant().getCollection();
        this.scoreThreshold = properties.getQdrant().getScoreThreshold();
    }

    /**
     * Returns at most {@code limit} candidates ordered by descending score.
     * An empty collection or a query below the score threshold gives an empty list.
     */
    public List<Candidate> findNearest(float[] vector, int limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", vector);
        body.put("limit", limit);
        body.put("with_payload", true);
        if (scoreThreshold != null) {
            body.put("score_threshold", scoreThreshold);
        }

        SearchResponse response;
        try {
            response = restClient.post()
                    .uri("/collections/{collection}/points/search", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(SearchResponse.class);
        } catch (RestClientException e) {
            throw new VectorSearchException("Qdrant search in collection '" + collection + "' failed", e);
        }

        if (response == null || response.result() == null) {
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>(response.result().size());
        for (ScoredPoint point : response.result()) {
            Map<String, Object> payload = point.payload() == null ? Map.of() : point.payload();
            candidates.add(new Candidate(
                    point.id() == null ? null : String.valueOf(point.id()),
                    asString(payload.get("document_id")),
                    point.score(),
                    asString(payload.get("topic")),
                    asString(payload.get("source"))
            ));
            if (candidates.size() >= limit) {
                break;
            }
        }
        log.debug("Qdrant returned {} candidates from '{}'", candidates.size(), collection);
        return candidates;
    }

    /**
     * Vector size of the collection, empty when the collection uses named vectors.
     */
    public OptionalInt describeVectorSize() {
        JsonNode info;
        try {
            info = restClient.get()
                    .uri("/collections/{collection}", collection)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new VectorSearchException("Cannot read Qdrant collection '" + collection + "'", e);
        }
        JsonNode size = info == null ? null : info.path("result").path("config").path("params").path("vectors").path("size");
        if (size == null || !size.canConvertToInt()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(size.asInt());
    }

    public String collection() {
        return collection;
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchResponse(List<ScoredPoint> result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScoredPoint(Object id, double score, Map<String, Object> payload) {
    }
}
