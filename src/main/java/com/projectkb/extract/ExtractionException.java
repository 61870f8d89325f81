package com.projectkb.extract;

import com.projectkb.ingest.ErrorKind;
import com.projectkb.ingest.IngestionException;

public class ExtractionException extends IngestionException {
    public ExtractionException(String message) {
        super(ErrorKind.EXTRACTION, message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION, message, cause);
    }
}
