package com.tenantseed.model;

/**
 * An organization or contact row together with the party it owns. {@code partyId} is null only
 * for contacts created before parties existed.
 */
public record PartyLink(long entityId, Long partyId) {
}
