package com.tenantseed.model.fixture;

/**
 * Display theme for a tenant. {@code name} is the base tenant name before qualification.
 */
public record ThemeFixture(
    String id,
    String name,
    String primaryColor,
    String secondaryColor,
    String accentColor,
    String logoText
) {
}
