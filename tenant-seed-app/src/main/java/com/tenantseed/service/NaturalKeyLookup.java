package com.tenantseed.service;

import java.util.Optional;

/**
 * Finds a persisted record by natural key. {@code scope} is null for kinds that are not scoped.
 */
@FunctionalInterface
public interface NaturalKeyLookup {

    Optional<Long> find(long tenantId, String scope, String key);
}
