package com.projectkb.store;

public enum DocumentStatus {
    PENDING,
    READY,
    FAILED
}
