package com.projectkb.ingest;

/**
 * One uploaded file as handed over by the caller. {@code declaredType} may be null or wrong; the
 * extractor decides the actual format.
 */
public record IngestionFile(String filename, byte[] content, String declaredType) {
    public IngestionFile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename is required");
        }
        if (content == null) {
            throw new IllegalArgumentException("content is required for " + filename);
        }
    }

    public long size() {
        return content.length;
    }
}
