package com.example.CourseRag.util;

import com.example.CourseRag.model.ContentChunk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractiveSummarizerTest {

    @Test
    void splitsOnSentenceEndsAndDropsShortFragments() {
        List<String> highlights = ExtractiveSummarizer.highlights(List.of(chunk(
                "Retrieval finds the relevant chunks first. Too short! Then the model writes an answer from them… ok?")));

        assertThat(highlights).containsExactly(
                "Retrieval finds the relevant chunks first",
                "Then the model writes an answer from them");
    }

    @Test
    void trimsDashesAndSemicolons() {
        List<String> highlights = ExtractiveSummarizer.highlights(List.of(chunk(
                "- Chunking keeps each fragment inside the model window;\n– Overlap preserves local context —")));

        assertThat(highlights).containsExactly(
                "Chunking keeps each fragment inside the model window;\n– Overlap preserves local context");
    }

    @Test
    void dropsCaseInsensitiveDuplicatesAcrossChunks() {
        List<String> highlights = ExtractiveSummarizer.highlights(List.of(
                chunk("Vector stores index embeddings for search."),
                chunk("VECTOR STORES INDEX EMBEDDINGS FOR SEARCH. Graphs link related topics together.")));

        assertThat(highlights).containsExactly(
                "Vector stores index embeddings for search",
                "Graphs link related topics together");
    }

    @Test
    void keepsAtMostFiveInChunkOrder() {
        List<String> highlights = ExtractiveSummarizer.highlights(List.of(
                chunk("First sentence is long enough. Second sentence is long enough. Third sentence is long enough."),
                chunk("Fourth sentence is long enough. Fifth sentence is long enough. Sixth sentence is long enough.")));

        assertThat(highlights).hasSize(5)
                .first().isEqualTo("First sentence is long enough");
        assertThat(highlights).last().isEqualTo("Fifth sentence is long enough");
    }

    @Test
    void countsCharactersNotBytes() {
        List<String> highlights = ExtractiveSummarizer.highlights(List.of(chunk("Векторный поиск по смыслу. Коротко.")));

        assertThat(highlights).containsExactly("Векторный поиск по смыслу");
    }

    @Test
    void emptyInputGivesNoHighlights() {
        assertThat(ExtractiveSummarizer.highlights(List.of())).isEmpty();
        assertThat(ExtractiveSummarizer.highlights(List.of(chunk(null)))).isEmpty();
    }

    private static ContentChunk chunk(String content) {
        return new ContentChunk(UUID.randomUUID(), "Lab", "rag", "notes.md", 0, content, 0.5);
    }
}
