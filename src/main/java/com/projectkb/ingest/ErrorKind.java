package com.projectkb.ingest;

/**
 * Why a single file of an ingestion job did not make it into the store.
 */
public enum ErrorKind {
    UNSUPPORTED_FORMAT,
    EXTRACTION,
    EMBEDDING,
    STORAGE,
    CANCELLED,
    ABORTED,
    INTERRUPTED,
    INTERNAL
}
