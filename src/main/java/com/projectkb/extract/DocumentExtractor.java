package com.projectkb.extract;

public interface DocumentExtractor {
    boolean supports(DocumentFormat format);

    ExtractionResult extract(String filename, byte[] content, DocumentFormat format) throws ExtractionException;
}
