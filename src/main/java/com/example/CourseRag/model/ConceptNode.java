package com.example.CourseRag.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param primary true when the topic came from the retrieved chunks, false when reached by expansion
 */
public record ConceptNode(
        String topicId,
        String label,
        List<String> relatedAssignmentTitles,
        @JsonProperty("is_primary") boolean primary
) {
    public ConceptNode withAssignments(List<String> titles) {
        return new ConceptNode(topicId, label, List.copyOf(titles), primary);
    }
}
