package com.projectkb.store;

/**
 * The backing store could not be read or written. Fatal for the ingestion job that hits it.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
