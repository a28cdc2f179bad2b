package com.tenantseed.model.fixture;

/**
 * Portal logins for one contact and one organization, both picked by fixture index.
 */
public record PortalAccessFixture(
    int contactIndex,
    UserFixture contactPortalUser,
    int orgIndex,
    UserFixture orgPortalUser
) {
}
