package com.tenantseed.model.fixture;

public record OrganizationFixture(
    String name,
    String email,
    String phone,
    String website,
    String city,
    String state,
    String country,
    boolean publicProgram,
    String programSlug,
    String programBio
) {
}
