package com.projectkb.job;

public enum FileState {
    PENDING,
    SUCCEEDED,
    FAILED
}
