package com.projectkb.extract;

import com.projectkb.ingest.ErrorKind;
import com.projectkb.ingest.IngestionException;

public class UnsupportedFormatException extends IngestionException {
    private final String detectedType;

    public UnsupportedFormatException(String filename, String detectedType) {
        super(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported content type " + detectedType + " for " + filename);
        this.detectedType = detectedType;
    }

    public String detectedType() {
        return detectedType;
    }
}
