package com.projectkb.retrieval;

/**
 * No candidate could be scored. Never leaves the reranker: it falls back to similarity order.
 */
public class RerankerUnavailableException extends Exception {
    public RerankerUnavailableException(String message) {
        super(message);
    }

    public RerankerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
