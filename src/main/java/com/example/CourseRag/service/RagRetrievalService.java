package com.example.CourseRag.service;

import com.example.CourseRag.embedding.QueryEmbeddingService;
import com.example.CourseRag.model.Candidate;
import com.example.CourseRag.repository.CourseVectorRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Retrieval half of the pipeline:
 * - embed the question (never fails, falls back to the hash embedding)
 * - query the vector index for the nearest chunks
 */
@Service
@RequiredArgsConstructor
public class RagRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RagRetrievalService.class);

    private final QueryEmbeddingService embeddingService;
    private final CourseVectorRepository vectorRepository;

    public List<Candidate> search(String question, int limit) {
        float[] queryVector = embeddingService.embed(question);
        List<Candidate> candidates = vectorRepository.findNearest(queryVector, limit);
        log.debug("Vector search: {} candidates for question='{}' (strategy={})",
                candidates.size(), question, embeddingService.activeStrategy());
        return candidates;
    }
}
