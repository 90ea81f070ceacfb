package com.example.CourseRag.exception;

/**
 * The vector index returned candidates but none of them resolved to a stored document.
 * Points at drift between the index and the relational store.
 */
public class DocumentsNotResolvedException extends RuntimeException {

    private final int candidateCount;

    public DocumentsNotResolvedException(int candidateCount) {
        super("None of " + candidateCount + " search candidates matched a stored document");
        this.candidateCount = candidateCount;
    }

    public int getCandidateCount() {
        return candidateCount;
    }
}
