package com.example.CourseRag.service;

import com.example.CourseRag.model.Candidate;
import com.example.CourseRag.model.ContentChunk;
import com.example.CourseRag.model.MaterialRecord;
import com.example.CourseRag.repository.CourseMaterialRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ContentHydrationServiceTest {

    private static final UUID FIRST = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID SECOND = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID THIRD = UUID.fromString("33333333-3333-3333-3333-333333333333");

    private final CourseMaterialRepository repository = mock(CourseMaterialRepository.class);
    private final ContentHydrationService service = new ContentHydrationService(repository);

    @Test
    void keepsCandidateOrderAndCarriesScores() {
        when(repository.findByIds(any())).thenReturn(Map.of(
                FIRST, record(FIRST, "Intro"),
                SECOND, record(SECOND, "Vectors"),
                THIRD, record(THIRD, "Graphs")));

        List<ContentChunk> chunks = service.hydrate(List.of(
                candidate(THIRD, 0.9), candidate(FIRST, 0.8), candidate(SECOND, 0.7)), 6);

        assertThat(chunks).extracting(ContentChunk::id).containsExactly(THIRD, FIRST, SECOND);
        assertThat(chunks).extracting(ContentChunk::score).containsExactly(0.9, 0.8, 0.7);
        assertThat(chunks.get(0).assignmentTitle()).isEqualTo("Graphs");
    }

    @Test
    void dropsCandidatesWithoutStoredRow() {
        when(repository.findByIds(any())).thenReturn(Map.of(SECOND, record(SECOND, "Vectors")));

        List<ContentChunk> chunks = service.hydrate(List.of(
                candidate(FIRST, 0.9), candidate(SECOND, 0.8), candidate(THIRD, 0.7)), 6);

        assertThat(chunks).extracting(ContentChunk::id).containsExactly(SECOND);
    }

    @Test
    @SuppressWarnings("unchecked")
    void skipsMalformedIdsAndLooksUpTheRestOnce() {
        when(repository.findByIds(any())).thenReturn(Map.of(FIRST, record(FIRST, "Intro")));

        List<ContentChunk> chunks = service.hydrate(List.of(
                new Candidate("p1", "doc-7", 0.95, null, null),
                new Candidate("p2", null, 0.9, null, null),
                new Candidate("p3", "1-1-1-1-1", 0.85, null, null),
                candidate(FIRST, 0.8)), 6);

        assertThat(chunks).extracting(ContentChunk::id).containsExactly(FIRST);
        ArgumentCaptor<Collection<UUID>> ids = ArgumentCaptor.forClass(Collection.class);
        verify(repository).findByIds(ids.capture());
        assertThat(ids.getValue()).containsExactly(FIRST);
    }

    @Test
    void stopsAtLimit() {
        when(repository.findByIds(any())).thenReturn(Map.of(
                FIRST, record(FIRST, "Intro"),
                SECOND, record(SECOND, "Vectors"),
                THIRD, record(THIRD, "Graphs")));

        List<ContentChunk> chunks = service.hydrate(List.of(
                candidate(FIRST, 0.9), candidate(SECOND, 0.8), candidate(THIRD, 0.7)), 2);

        assertThat(chunks).extracting(ContentChunk::id).containsExactly(FIRST, SECOND);
    }

    @Test
    void noParsableIdSkipsTheDatabase() {
        List<ContentChunk> chunks = service.hydrate(List.of(
                new Candidate("p1", "not-a-uuid", 0.9, "rag", "a.md")), 6);

        assertThat(chunks).isEmpty();
        verifyNoInteractions(repository);
    }

    @Test
    void parseIdAcceptsUuidSpellings() {
        assertThat(parseId(FIRST.toString())).contains(FIRST);
        assertThat(parseId(FIRST.toString().toUpperCase())).contains(FIRST);
        assertThat(parseId("11111111111111111111111111111111")).contains(FIRST);
        assertThat(parseId("{11111111-1111-1111-1111-111111111111}")).contains(FIRST);
        assertThat(parseId("urn:uuid:11111111-1111-1111-1111-111111111111")).contains(FIRST);
        assertThat(parseId("0b7c3f5e1f0a4c9e9a426a1d2c3b4e01"))
                .contains(UUID.fromString("0b7c3f5e-1f0a-4c9e-9a42-6a1d2c3b4e01"));
    }

    @Test
    void parseIdRejectsMalformedIds() {
        assertThat(parseId(null)).isEmpty();
        assertThat(parseId("")).isEmpty();
        assertThat(parseId("1-1-1-1-1")).isEmpty();
        assertThat(parseId("doc-7")).isEmpty();
        assertThat(parseId(" " + FIRST + " ")).isEmpty();
        assertThat(parseId("1111111111111111111111111111111g")).isEmpty();
        assertThat(parseId("111111111111111111111111111111111")).isEmpty();
    }

    @Test
    void unhyphenatedIdsHydrate() {
        when(repository.findByIds(any())).thenReturn(Map.of(SECOND, record(SECOND, "Vectors")));

        List<ContentChunk> chunks = service.hydrate(List.of(
                new Candidate("p1", "22222222222222222222222222222222", 0.9, "rag", "notes.md")), 6);

        assertThat(chunks).extracting(ContentChunk::id).containsExactly(SECOND);
    }

    private static Optional<UUID> parseId(String documentId) {
        return ContentHydrationService.parseId(new Candidate("p", documentId, 1.0, null, null));
    }

    private static Candidate candidate(UUID id, double score) {
        return new Candidate("point-" + id, id.toString(), score, "rag", "notes.md");
    }

    private static MaterialRecord record(UUID id, String title) {
        return new MaterialRecord(id, "Content of " + title + ".", "notes.md", 0, title, "rag");
    }
}
