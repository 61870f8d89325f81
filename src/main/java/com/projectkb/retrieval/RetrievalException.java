package com.projectkb.retrieval;

/**
 * A query could not be answered at all, e.g. because it could not be embedded.
 */
public class RetrievalException extends RuntimeException {
    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
