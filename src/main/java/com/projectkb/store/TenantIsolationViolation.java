package com.projectkb.store;

/**
 * A read scoped to one project reached data of another. Indicates a bug, never a runtime condition.
 */
public class TenantIsolationViolation extends IllegalStateException {
    public TenantIsolationViolation(String requestedProject, String foundProject, String chunkId) {
        super("Chunk " + chunkId + " of project " + foundProject + " surfaced in a search scoped to " + requestedProject);
    }
}
