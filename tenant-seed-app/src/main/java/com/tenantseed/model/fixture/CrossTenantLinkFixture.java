package com.tenantseed.model.fixture;

import com.tenantseed.model.LineageParentType;
import com.tenantseed.model.LinkMethod;

/**
 * Declares that an animal of one tenant has a sire or dam owned by another tenant. Tenants are
 * referenced by base slug and animals by base name within the species.
 */
public record CrossTenantLinkFixture(
    String childTenantSlug,
    String childAnimalRef,
    String parentTenantSlug,
    String parentAnimalRef,
    String species,
    LineageParentType parentType,
    LinkMethod linkMethod
) {
    public CrossTenantLinkFixture {
        linkMethod = linkMethod == null ? LinkMethod.MANUAL : linkMethod;
    }
}
