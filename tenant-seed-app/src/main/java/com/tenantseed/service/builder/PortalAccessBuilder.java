package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.MembershipRole;
import com.tenantseed.model.PortalAccess;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.PortalAccessFixture;
import com.tenantseed.model.fixture.UserFixture;
import com.tenantseed.repository.PortalAccessRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Client-portal logins for one contact and one organization.
 * <p>
 * Converges to the same end state from any earlier partial run: the portal user is created if
 * missing, a party has at most one access row which gets linked to the user if it was created
 * unlinked, and the user ends up with a CLIENT membership in the tenant.
 */
@Component
public class PortalAccessBuilder {

    private static final Logger log = LoggerFactory.getLogger(PortalAccessBuilder.class);

    private final PortalAccessRepository portalAccess;
    private final UserBuilder users;
    private final Clock clock;

    public PortalAccessBuilder(PortalAccessRepository portalAccess, UserBuilder users, Clock clock) {
        this.portalAccess = portalAccess;
        this.users = users;
        this.clock = clock;
    }

    public void build(SeedContext ctx, TenantScope scope, PortalAccessFixture fixture) {
        if (fixture == null) {
            return;
        }
        grant(ctx, scope, RefKind.CONTACT_PARTY, fixture.contactIndex(), fixture.contactPortalUser());
        grant(ctx, scope, RefKind.ORGANIZATION_PARTY, fixture.orgIndex(), fixture.orgPortalUser());
    }

    private void grant(SeedContext ctx, TenantScope scope, RefKind partyKind, int index, UserFixture portalUser) {
        if (portalUser == null) {
            return;
        }
        Lookup party = ctx.resolver().resolve(scope.tenantId(), partyKind, Handle.indexed(index));
        if (!party.isFound()) {
            log.warn("  ! No {} #{} for portal access", partyKind, index);
            return;
        }
        long partyId = party.getId();
        long userId = users.seedUser(ctx, portalUser, scope.tenantId()).id();
        Instant now = clock.instant();

        UpsertResult access = ctx.upsert().upsert(EntityKind.PORTAL_ACCESS, scope.tenantId(),
            "party " + partyId, portalUser.email(),
            () -> Lookup.of(portalAccess.findByParty(partyId).map(PortalAccess::id)),
            () -> portalAccess.save(scope.tenantId(), partyId, userId, now, now));

        if (!access.created()) {
            PortalAccess existing = portalAccess.findByParty(partyId)
                .orElseThrow(() -> new IllegalStateException("Portal access vanished for party " + partyId));
            if (existing.userId() == null && portalAccess.linkUser(existing.id(), userId, now)) {
                log.info("    ~ Linked portal access for party {} to user {}", partyId, userId);
            }
        }

        users.ensureMembership(ctx, scope, userId, MembershipRole.VIEWER, MembershipRole.CLIENT);
    }
}
