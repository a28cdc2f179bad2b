package com.tenantseed.model.fixture;

import java.util.List;

/**
 * Root of a fixture catalogue: global marketplace shoppers, the tenants in seeding order, and
 * lineage links between animals of different tenants.
 */
public record SeedCatalogue(
    List<UserFixture> marketplaceUsers,
    List<TenantFixture> tenants,
    List<CrossTenantLinkFixture> crossTenantLinks
) {
    public SeedCatalogue {
        marketplaceUsers = marketplaceUsers == null ? List.of() : List.copyOf(marketplaceUsers);
        tenants = tenants == null ? List.of() : List.copyOf(tenants);
        crossTenantLinks = crossTenantLinks == null ? List.of() : List.copyOf(crossTenantLinks);
    }
}
