package com.projectkb.embed;

public class GateTimeoutException extends Exception {
    public GateTimeoutException(long waitedMs) {
        super("No provider permit available after " + waitedMs + " ms");
    }
}
