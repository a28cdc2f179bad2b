package com.tenantseed.model;

public record PortalAccess(
    long id,
    long partyId,
    PortalAccessStatus status,
    Long userId      // null until a portal login is linked
) {
}
