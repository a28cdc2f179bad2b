package com.tenantseed.model.fixture;

public record MarketplaceVisibility(
    boolean publicProgram,
    boolean activeListings,
    int programsEnabled,
    int programsSaved
) {
}
