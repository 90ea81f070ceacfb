package com.example.CourseRag.service;

import com.example.CourseRag.generation.AnswerGenerator;
import com.example.CourseRag.generation.DisabledAnswerGenerator;
import com.example.CourseRag.generation.GenerationResult;
import com.example.CourseRag.model.ContentChunk;
import com.example.CourseRag.util.AnswerMarkdown;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnswerSynthesisServiceTest {

    private static final String QUESTION = "Как устроен RAG-пайплайн?";

    private final List<ContentChunk> chunks = List.of(
            new ContentChunk(UUID.randomUUID(), "Lab 1", "rag-pipeline", "lab1.md", 0,
                    "Retrieval selects the relevant course fragments. The generator answers from them.", 0.9),
            new ContentChunk(UUID.randomUUID(), "Lecture 3", null, "lecture3.pdf", 2,
                    "Embeddings map text to vectors of a fixed dimension.", 0.8));

    @Test
    void failedGenerationEqualsExtractiveAnswer() {
        AnswerGenerator generator = generator();
        when(generator.generate(anyString(), anyList()))
                .thenReturn(GenerationResult.failed(new IllegalStateException("quota exceeded")));
        AnswerSynthesisService service = new AnswerSynthesisService(generator);

        assertThat(service.synthesize(QUESTION, chunks)).isEqualTo(service.extractive(QUESTION, chunks));
    }

    @Test
    void blankGenerationEqualsExtractiveAnswer() {
        AnswerGenerator generator = generator();
        when(generator.generate(anyString(), anyList())).thenReturn(GenerationResult.ok("  "));
        AnswerSynthesisService service = new AnswerSynthesisService(generator);

        assertThat(service.synthesize(QUESTION, chunks)).isEqualTo(service.extractive(QUESTION, chunks));
    }

    @Test
    void generatedProseKeepsTheSharedLayout() {
        AnswerGenerator generator = generator();
        when(generator.generate(anyString(), anyList()))
                .thenReturn(GenerationResult.ok("- Сначала поиск находит фрагменты [1]."));
        AnswerSynthesisService service = new AnswerSynthesisService(generator);

        String answer = service.synthesize(QUESTION, chunks);

        assertThat(answer)
                .startsWith(AnswerMarkdown.intro(QUESTION))
                .contains(AnswerMarkdown.SUMMARY_HEADING + "\n\n- Сначала поиск находит фрагменты [1].")
                .contains(AnswerMarkdown.SOURCES_HEADING)
                .contains("1. **Lab 1 · rag-pipeline** (lab1.md, chunk #0)")
                .contains("2. **Lecture 3** (lecture3.pdf, chunk #2)")
                .endsWith(AnswerMarkdown.OUTRO);
    }

    @Test
    void disabledGeneratorIsNeverCalled() {
        AnswerGenerator generator = mock(AnswerGenerator.class);
        when(generator.enabled()).thenReturn(false);
        AnswerSynthesisService service = new AnswerSynthesisService(generator);

        service.synthesize(QUESTION, chunks);

        verify(generator, never()).generate(any(), any());
    }

    @Test
    void extractiveAnswerListsHighlightsAndSources() {
        String answer = new AnswerSynthesisService(new DisabledAnswerGenerator()).synthesize(QUESTION, chunks);

        assertThat(answer).isEqualTo("""
                ### Короткий ответ на запрос «Как устроен RAG-пайплайн?»

                #### Главное

                - Retrieval selects the relevant course fragments
                - The generator answers from them
                - Embeddings map text to vectors of a fixed dimension

                #### Использованные фрагменты

                1. **Lab 1 · rag-pipeline** (lab1.md, chunk #0)
                   > Retrieval selects the relevant course fragments. The generator answers from them.
                2. **Lecture 3** (lecture3.pdf, chunk #2)
                   > Embeddings map text to vectors of a fixed dimension.

                """ + AnswerMarkdown.OUTRO);
    }

    @Test
    void noHighlightsGivesPlaceholder() {
        List<ContentChunk> terse = List.of(new ContentChunk(UUID.randomUUID(), "Quiz", "rag", null, null, "Short.", 0.4));

        String answer = new AnswerSynthesisService(new DisabledAnswerGenerator()).synthesize(QUESTION, terse);

        assertThat(answer)
                .contains("- " + AnswerMarkdown.PLACEHOLDER_HIGHLIGHT)
                .contains("1. **Quiz · rag**\n   > Short.");
    }

    private static AnswerGenerator generator() {
        AnswerGenerator generator = mock(AnswerGenerator.class);
        when(generator.enabled()).thenReturn(true);
        when(generator.name()).thenReturn("chat-model");
        return generator;
    }
}
