package com.projectkb.job;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Transitions only move forward and never leave a terminal status. */
    public boolean canMoveTo(JobStatus next) {
        return !isTerminal() && next.ordinal() > ordinal();
    }
}
