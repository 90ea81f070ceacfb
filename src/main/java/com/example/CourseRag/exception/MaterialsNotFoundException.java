package com.example.CourseRag.exception;

/**
 * The vector index returned no candidates for the question.
 */
public class MaterialsNotFoundException extends RuntimeException {

    public MaterialsNotFoundException(String question) {
        super("No course materials found for query: " + question);
    }
}
