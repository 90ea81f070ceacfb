package com.example.CourseRag.exception;

/**
 * Rejected request: blank question or a chunk limit outside the allowed range.
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
