package com.tenantseed.model;

import com.tenantseed.model.fixture.VisibilityPolicy;

import java.util.Map;

/**
 * Per-animal privacy flags. Built from the tenant's visibility policy, then adjusted field by
 * field with the animal's own overrides.
 */
public record PrivacySettings(
    boolean showName,
    boolean showPhoto,
    boolean showFullDob,
    boolean showRegistryFull,
    boolean enableHealthSharing,
    boolean enableGeneticsSharing,
    boolean showBreeder,
    boolean allowCrossTenantMatching
) {

    public static PrivacySettings defaultsFrom(VisibilityPolicy policy) {
        return new PrivacySettings(
            policy.defaultShowName(),
            policy.defaultShowPhoto(),
            policy.defaultShowFullDob(),
            policy.defaultShowRegistryFull(),
            policy.defaultShowHealthResults(),
            policy.defaultShowGeneticData(),
            policy.defaultShowBreeder(),
            policy.allowCrossTenantMatching()
        );
    }

    /**
     * Returns a copy with every override applied. Override keys use the fixture vocabulary
     * ({@code showHealthResults}, {@code showGeneticData}, ...); an unknown key is a data error.
     *
     * @throws IllegalArgumentException for an override key that names no privacy flag
     */
    public PrivacySettings withOverrides(Map<String, Boolean> overrides) {
        boolean name = showName;
        boolean photo = showPhoto;
        boolean fullDob = showFullDob;
        boolean registry = showRegistryFull;
        boolean health = enableHealthSharing;
        boolean genetics = enableGeneticsSharing;
        boolean breeder = showBreeder;
        boolean crossTenant = allowCrossTenantMatching;

        for (Map.Entry<String, Boolean> entry : overrides.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            boolean value = entry.getValue();
            switch (entry.getKey()) {
                case "showName": name = value; break;
                case "showPhoto": photo = value; break;
                case "showFullDob": fullDob = value; break;
                case "showRegistryFull": registry = value; break;
                case "showHealthResults": health = value; break;
                case "showGeneticData": genetics = value; break;
                case "showBreeder": breeder = value; break;
                case "allowCrossTenantMatching": crossTenant = value; break;
                default:
                    throw new IllegalArgumentException("Unknown privacy override: " + entry.getKey());
            }
        }
        return new PrivacySettings(name, photo, fullDob, registry, health, genetics, breeder, crossTenant);
    }
}
