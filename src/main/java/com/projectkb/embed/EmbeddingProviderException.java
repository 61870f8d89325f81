package com.projectkb.embed;

public class EmbeddingProviderException extends Exception {
    private final boolean transientFailure;

    public EmbeddingProviderException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public EmbeddingProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    /** Timeouts, throttling and server errors; worth retrying as is. */
    public boolean isTransient() {
        return transientFailure;
    }

    static boolean isTransientStatus(int httpStatus) {
        return httpStatus == 408 || httpStatus == 429 || httpStatus >= 500;
    }
}
