package com.example.CourseRag.service;

import com.example.CourseRag.generation.AnswerGenerator;
import com.example.CourseRag.generation.GenerationResult;
import com.example.CourseRag.model.ContentChunk;
import com.example.CourseRag.util.AnswerMarkdown;
import com.example.CourseRag.util.ExtractiveSummarizer;
import com.example.CourseRag.util.OneTimeWarnings;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Writes the Markdown answer.
 *
 * Tries the generative tier when it is enabled and there is context, and falls back to
 * the extractive summary on any failure. Both tiers end with the same source listing.
 */
@Service
@RequiredArgsConstructor
public class AnswerSynthesisService {

    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesisService.class);

    private final AnswerGenerator answerGenerator;
    private final OneTimeWarnings warnings = new OneTimeWarnings(log);

    public String synthesize(String question, List<ContentChunk> chunks) {
        if (answerGenerator.enabled() && !chunks.isEmpty()) {
            GenerationResult result = answerGenerator.generate(question, chunks);
            if (result.isOk()) {
                return AnswerMarkdown.generative(question, result.text(), chunks);
            }
            warnings.warn(answerGenerator.name(),
                    "Generative answer via '{}' failed, using extractive summary: {}",
                    answerGenerator.name(), result.error() == null ? "empty output" : result.error().toString());
        }
        return extractive(question, chunks);
    }

    public String extractive(String question, List<ContentChunk> chunks) {
        return AnswerMarkdown.extractive(question, ExtractiveSummarizer.highlights(chunks), chunks);
    }
}
