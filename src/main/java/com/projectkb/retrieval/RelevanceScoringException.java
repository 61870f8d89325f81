package com.projectkb.retrieval;

public class RelevanceScoringException extends Exception {
    public RelevanceScoringException(String message) {
        super(message);
    }

    public RelevanceScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
