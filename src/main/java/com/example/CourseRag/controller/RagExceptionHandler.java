package com.example.CourseRag.controller;

import com.example.CourseRag.exception.DocumentsNotResolvedException;
import com.example.CourseRag.exception.InvalidQueryException;
import com.example.CourseRag.exception.MaterialsNotFoundException;
import com.example.CourseRag.exception.VectorSearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps pipeline failures to JSON error bodies: {"error": code, "message": text}.
 */
@RestControllerAdvice
public class RagExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RagExceptionHandler.class);

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidQuery(InvalidQueryException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_query", ex.getMessage());
    }

    @ExceptionHandler(MaterialsNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(MaterialsNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "materials_not_found", "Материалы по запросу не найдены.");
    }

    @ExceptionHandler(DocumentsNotResolvedException.class)
    public ResponseEntity<Map<String, Object>> handleNotResolved(DocumentsNotResolvedException ex) {
        return error(HttpStatus.NOT_FOUND, "documents_not_resolved", "Не удалось сопоставить документы в Postgres.");
    }

    @ExceptionHandler(VectorSearchException.class)
    public ResponseEntity<Map<String, Object>> handleVectorSearch(VectorSearchException ex) {
        log.error("Vector search failed", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "vector_index_unavailable", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
