package com.example.CourseRag.service;

import com.example.CourseRag.config.RagProperties;
import com.example.CourseRag.exception.DocumentsNotResolvedException;
import com.example.CourseRag.exception.InvalidQueryException;
import com.example.CourseRag.exception.MaterialsNotFoundException;
import com.example.CourseRag.model.Candidate;
import com.example.CourseRag.model.ChatResponse;
import com.example.CourseRag.model.ContentChunk;
import com.example.CourseRag.model.GraphContext;
import com.example.CourseRag.util.OneTimeWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Answers one question end to end:
 * - validate the request
 * - embed and search (no candidates: {@link MaterialsNotFoundException})
 * - hydrate from the relational store (nothing resolved: {@link DocumentsNotResolvedException})
 * - build graph context and synthesize the answer concurrently
 *
 * Every backend is called at most once per request. Graph and generation problems degrade
 * the response instead of failing it.
 */
@Service
public class RagChatService {

    private static final Logger log = LoggerFactory.getLogger(RagChatService.class);

    private final RagRetrievalService retrievalService;
    private final ContentHydrationService hydrationService;
    private final GraphContextService graphContextService;
    private final AnswerSynthesisService synthesisService;
    private final RagProperties.Chat chatProperties;
    private final Duration graphTimeout;
    private final OneTimeWarnings warnings = new OneTimeWarnings(log);

    public RagChatService(RagRetrievalService retrievalService,
                          ContentHydrationService hydrationService,
                          GraphContextService graphContextService,
                          AnswerSynthesisService synthesisService,
                          RagProperties properties) {
        this.retrievalService = retrievalService;
        this.hydrationService = hydrationService;
        this.graphContextService = graphContextService;
        this.synthesisService = synthesisService;
        this.chatProperties = properties.getChat();
        this.graphTimeout = properties.getGraph().getTimeout();
    }

    /**
     * @param limit number of context chunks, null for the configured default
     */
    public ChatResponse answer(String question, Integer limit) {
        int resolvedLimit = validate(question, limit);

        List<Candidate> candidates = retrievalService.search(question, resolvedLimit);
        if (candidates.isEmpty()) {
            throw new MaterialsNotFoundException(question);
        }

        List<ContentChunk> sources = hydrationService.hydrate(candidates, resolvedLimit);
        if (sources.isEmpty()) {
            log.warn("Vector index and relational store disagree: {} candidates, none resolved (ids={})",
                    candidates.size(), candidates.stream().map(Candidate::documentId).toList());
            throw new DocumentsNotResolvedException(candidates.size());
        }

        Set<String> topics = topicsOf(sources);

        Mono<Optional<GraphContext>> graphMono = Mono.fromCallable(() -> graphContextService.build(topics))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(graphTimeout)
                .onErrorResume(e -> {
                    warnings.warn("graph-context", "Graph context skipped: {}", e.toString());
                    return Mono.just(Optional.<GraphContext>empty());
                });

        Mono<String> answerMono = Mono.fromCallable(() -> synthesisService.synthesize(question, sources))
                .subscribeOn(Schedulers.boundedElastic());

        Tuple2<String, Optional<GraphContext>> result = Mono.zip(answerMono, graphMono)
                .blockOptional()
                .orElseThrow(() -> new IllegalStateException("Answer pipeline completed without a result"));

        log.debug("Answered question='{}' with {} sources, graph={}",
                question, sources.size(), result.getT2().isPresent());
        return new ChatResponse(result.getT1(), sources, result.getT2().orElse(null));
    }

    public List<String> examplePrompts() {
        return List.copyOf(chatProperties.getExamplePrompts());
    }

    private int validate(String question, Integer limit) {
        if (question == null || question.isBlank()) {
            throw new InvalidQueryException("Question must not be empty");
        }
        int resolved = limit == null ? chatProperties.getDefaultLimit() : limit;
        if (resolved < chatProperties.getMinLimit() || resolved > chatProperties.getMaxLimit()) {
            throw new InvalidQueryException("limit must be between " + chatProperties.getMinLimit()
                    + " and " + chatProperties.getMaxLimit() + ", got " + resolved);
        }
        return resolved;
    }

    private static Set<String> topicsOf(List<ContentChunk> sources) {
        Set<String> topics = new LinkedHashSet<>();
        for (ContentChunk chunk : sources) {
            if (chunk.topic() != null && !chunk.topic().isBlank()) {
                topics.add(chunk.topic());
            }
        }
        return topics;
    }
}
