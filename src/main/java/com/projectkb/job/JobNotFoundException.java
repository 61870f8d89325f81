package com.projectkb.job;

public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("Ingestion job " + jobId + " not found");
    }
}
