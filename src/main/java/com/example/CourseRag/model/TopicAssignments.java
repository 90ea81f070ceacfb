package com.example.CourseRag.model;

import java.util.List;

/**
 * Assignment titles linked to one topic via ASSOCIATED_WITH.
 */
public record TopicAssignments(
        String topicId,
        String label,
        List<String> titles
) {
}
