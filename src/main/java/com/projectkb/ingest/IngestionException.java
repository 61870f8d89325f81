package com.projectkb.ingest;

/**
 * Expected, per-file failure of the ingestion pipeline. Recorded against the file; never aborts a job.
 */
public class IngestionException extends Exception {
    private final ErrorKind kind;

    public IngestionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public IngestionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
