package com.tenantseed.model;

import com.tenantseed.model.fixture.VisibilityPolicy;

/**
 * The tenant a builder works inside. {@code baseSlug} is the unqualified catalogue slug.
 */
public record TenantScope(long tenantId, String baseSlug, SeedEnvironment environment,
                          VisibilityPolicy visibility) {

    public String qualifiedSlug() {
        return environment.qualifySlug(baseSlug);
    }

    public String name(String base) {
        return environment.qualifyName(base);
    }

    public String email(String base) {
        return environment.qualifyEmail(base);
    }
}
