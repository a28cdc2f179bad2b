package com.tenantseed.model.fixture;

/**
 * Tenant-wide lineage visibility defaults. Stored as the {@code lineage-visibility} setting
 * and used as the base for every animal's privacy settings.
 */
public record VisibilityPolicy(
    boolean allowCrossTenantMatching,
    boolean defaultShowName,
    boolean defaultShowPhoto,
    boolean defaultShowFullDob,
    boolean defaultShowRegistryFull,
    boolean defaultShowHealthResults,
    boolean defaultShowGeneticData,
    boolean defaultShowBreeder,
    boolean defaultAllowInfoRequests,
    boolean defaultAllowDirectContact
) {
}
