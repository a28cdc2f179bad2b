package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.PartyLink;
import com.tenantseed.model.PartyType;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.OrganizationFixture;
import com.tenantseed.repository.OrganizationRepository;
import com.tenantseed.repository.PartyRepository;
import com.tenantseed.service.SeedContext;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Organizations, each created together with the party it owns.
 */
@Component
public class OrganizationBuilder {

    private final OrganizationRepository organizations;
    private final PartyRepository parties;

    public OrganizationBuilder(OrganizationRepository organizations, PartyRepository parties) {
        this.organizations = organizations;
        this.parties = parties;
    }

    public void build(SeedContext ctx, TenantScope scope, List<OrganizationFixture> fixtures) {
        for (OrganizationFixture org : fixtures) {
            seed(ctx, scope, org);
        }
    }

    /**
     * @return the organization's party id
     */
    long seed(SeedContext ctx, TenantScope scope, OrganizationFixture org) {
        long tenantId = scope.tenantId();
        String name = scope.name(org.name());
        String email = org.email() == null ? null : scope.email(org.email());
        String programSlug = org.programSlug() == null ? null : scope.environment().qualifySlug(org.programSlug());

        UpsertResult result = ctx.upsert().upsert(EntityKind.ORGANIZATION, tenantId, name, org,
            () -> Lookup.of(organizations.findByName(tenantId, name).map(PartyLink::entityId)),
            () -> {
                long partyId = parties.save(tenantId, PartyType.ORGANIZATION, name, email, org.phone(),
                    org.city(), org.state(), org.country());
                return organizations.save(tenantId, partyId, name, email, programSlug, org);
            });
        if (result.created()) {
            ctx.tally().recordCreated(EntityKind.PARTY);
        }

        long partyId = organizations.findPartyId(result.id())
            .orElseThrow(() -> new IllegalStateException("Organization without party: " + name));
        ctx.resolver().register(tenantId, RefKind.ORGANIZATION_PARTY, Handle.named(name), partyId);
        return partyId;
    }
}
