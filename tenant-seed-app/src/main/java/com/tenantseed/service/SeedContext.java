package com.tenantseed.service;

import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.SeedTally;

/**
 * Everything one seeding run threads through its phases. A new context is created per run so
 * nothing carries over between runs.
 */
public record SeedContext(
    SeedEnvironment environment,
    ReferenceResolver resolver,
    IdempotentUpsert upsert,
    SeedTally tally
) {
}
