package com.tenantseed.service;

import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.SeedTally;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class SeedContextFactory {

    private final TransactionTemplate transactionTemplate;
    private final ReferenceLookups lookups;

    public SeedContextFactory(TransactionTemplate transactionTemplate, ReferenceLookups lookups) {
        this.transactionTemplate = transactionTemplate;
        this.lookups = lookups;
    }

    public SeedContext newContext(SeedEnvironment environment) {
        SeedTally tally = new SeedTally();
        return new SeedContext(
            environment,
            new ReferenceResolver(lookups.all()),
            new IdempotentUpsert(transactionTemplate, tally),
            tally
        );
    }
}
