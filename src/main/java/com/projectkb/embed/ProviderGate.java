package com.projectkb.embed;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size permit pool in front of the rate-limited providers. One instance is shared by every
 * ingestion job and every query so the global number of in-flight provider calls stays bounded.
 */
public class ProviderGate {
    private final Semaphore permits;
    private final long acquireTimeoutMs;

    public ProviderGate(int permits, long acquireTimeoutMs) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be > 0");
        }
        this.permits = new Semaphore(permits, true);
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    public <T, E extends Exception> T withPermit(GatedCall<T, E> call)
            throws E, GateTimeoutException, InterruptedException {
        if (!permits.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
            throw new GateTimeoutException(acquireTimeoutMs);
        }
        try {
            return call.call();
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    @FunctionalInterface
    public interface GatedCall<T, E extends Exception> {
        T call() throws E;
    }
}
