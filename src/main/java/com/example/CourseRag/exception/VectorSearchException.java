package com.example.CourseRag.exception;

public class VectorSearchException extends RuntimeException {

    public VectorSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
