package com.projectkb.store;

public class DocumentNotFoundException extends RuntimeException {
    public DocumentNotFoundException(String projectId, String documentId) {
        super("Document " + documentId + " not found in project " + projectId);
    }
}
