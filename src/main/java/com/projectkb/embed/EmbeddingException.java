package com.projectkb.embed;

import com.projectkb.ingest.ErrorKind;
import com.projectkb.ingest.IngestionException;

/**
 * A single input that could not be embedded, even on its own.
 */
public class EmbeddingException extends IngestionException {
    private final int inputIndex;

    public EmbeddingException(int inputIndex, String message, Throwable cause) {
        super(ErrorKind.EMBEDDING, message, cause);
        this.inputIndex = inputIndex;
    }

    public int inputIndex() {
        return inputIndex;
    }
}
