package com.tenantseed.model;

import java.util.List;

/**
 * Outcome of a full seeding run. The run succeeded only if no tenant failed.
 */
public record SeedReport(SeedEnvironment environment, int tenantsProcessed, SeedTally tally,
                         List<TenantFailure> failures) {

    public SeedReport {
        failures = List.copyOf(failures);
    }

    public boolean succeeded() {
        return failures.isEmpty();
    }
}
