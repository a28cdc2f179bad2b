package com.tenantseed.service;

import com.tenantseed.model.Handle;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.SeededLitter;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.fixture.AnimalFixture;
import com.tenantseed.model.fixture.BreedingPlanFixture;
import com.tenantseed.model.fixture.ContactFixture;
import com.tenantseed.model.fixture.OrganizationFixture;
import com.tenantseed.model.fixture.TenantFixture;
import com.tenantseed.model.fixture.UserFixture;
import com.tenantseed.service.builder.AnimalBuilder;
import com.tenantseed.service.builder.BreedingPlanBuilder;
import com.tenantseed.service.builder.ContactBuilder;
import com.tenantseed.service.builder.DraftBuilder;
import com.tenantseed.service.builder.EmailBuilder;
import com.tenantseed.service.builder.ListingBuilder;
import com.tenantseed.service.builder.MessageThreadBuilder;
import com.tenantseed.service.builder.OffspringGroupBuilder;
import com.tenantseed.service.builder.OrganizationBuilder;
import com.tenantseed.service.builder.PortalAccessBuilder;
import com.tenantseed.service.builder.TagBuilder;
import com.tenantseed.service.builder.TenantBuilder;
import com.tenantseed.service.builder.TitleBuilder;
import com.tenantseed.service.builder.UserBuilder;
import com.tenantseed.service.builder.WaitlistBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Seeds one tenant, phase by phase, in dependency order. Any exception escaping a phase
 * abandons the rest of the tenant; the caller decides what that means for the run.
 */
@Service
public class TenantSeeder {

    private static final Logger log = LoggerFactory.getLogger(TenantSeeder.class);

    private final TenantBuilder tenantBuilder;
    private final UserBuilder userBuilder;
    private final OrganizationBuilder organizationBuilder;
    private final ContactBuilder contactBuilder;
    private final LineageSequencer lineageSequencer;
    private final AnimalBuilder animalBuilder;
    private final TitleBuilder titleBuilder;
    private final BreedingPlanBuilder breedingPlanBuilder;
    private final OffspringGroupBuilder offspringGroupBuilder;
    private final ListingBuilder listingBuilder;
    private final TagBuilder tagBuilder;
    private final PortalAccessBuilder portalAccessBuilder;
    private final WaitlistBuilder waitlistBuilder;
    private final EmailBuilder emailBuilder;
    private final MessageThreadBuilder messageThreadBuilder;
    private final DraftBuilder draftBuilder;

    public TenantSeeder(TenantBuilder tenantBuilder,
                        UserBuilder userBuilder,
                        OrganizationBuilder organizationBuilder,
                        ContactBuilder contactBuilder,
                        LineageSequencer lineageSequencer,
                        AnimalBuilder animalBuilder,
                        TitleBuilder titleBuilder,
                        BreedingPlanBuilder breedingPlanBuilder,
                        OffspringGroupBuilder offspringGroupBuilder,
                        ListingBuilder listingBuilder,
                        TagBuilder tagBuilder,
                        PortalAccessBuilder portalAccessBuilder,
                        WaitlistBuilder waitlistBuilder,
                        EmailBuilder emailBuilder,
                        MessageThreadBuilder messageThreadBuilder,
                        DraftBuilder draftBuilder) {
        this.tenantBuilder = tenantBuilder;
        this.userBuilder = userBuilder;
        this.organizationBuilder = organizationBuilder;
        this.contactBuilder = contactBuilder;
        this.lineageSequencer = lineageSequencer;
        this.animalBuilder = animalBuilder;
        this.titleBuilder = titleBuilder;
        this.breedingPlanBuilder = breedingPlanBuilder;
        this.offspringGroupBuilder = offspringGroupBuilder;
        this.listingBuilder = listingBuilder;
        this.tagBuilder = tagBuilder;
        this.portalAccessBuilder = portalAccessBuilder;
        this.waitlistBuilder = waitlistBuilder;
        this.emailBuilder = emailBuilder;
        this.messageThreadBuilder = messageThreadBuilder;
        this.draftBuilder = draftBuilder;
    }

    public TenantScope seed(SeedContext ctx, TenantFixture fixture, List<UserFixture> marketplaceUsers) {
        // ========== TENANT & OWNER ==========
        TenantScope scope = tenantBuilder.build(ctx, fixture);
        log.info("Tenant {} (id {})", scope.qualifiedSlug(), scope.tenantId());
        long ownerId = userBuilder.seedOwner(ctx, scope, fixture.owner());

        indexHandles(ctx, scope, fixture);

        // ========== PARTIES ==========
        log.info(" Organizations: {}", fixture.organizations().size());
        organizationBuilder.build(ctx, scope, fixture.organizations());
        log.info(" Contacts: {}", fixture.contacts().size());
        contactBuilder.build(ctx, scope, fixture.contacts());

        // ========== ANIMALS ==========
        List<AnimalFixture> ordered = lineageSequencer.order(fixture.animals());
        log.info(" Animals: {}", ordered.size());
        List<Long> animalIds = animalBuilder.build(ctx, scope, ordered);
        titleBuilder.build(ctx, scope, ordered);

        // ========== BREEDING & MARKETPLACE ==========
        log.info(" Breeding plans: {}", fixture.breedingPlans().size());
        breedingPlanBuilder.build(ctx, scope, fixture.breedingPlans());
        log.info(" Offspring groups: {}", fixture.offspringGroups().size());
        List<SeededLitter> litters = offspringGroupBuilder.build(ctx, scope, fixture.offspringGroups());
        log.info(" Listings: {}", fixture.listings().size());
        listingBuilder.build(ctx, scope, fixture.listings());
        tagBuilder.build(ctx, scope, animalIds, litters);

        // ========== CLIENTS ==========
        portalAccessBuilder.build(ctx, scope, fixture.portalAccess());
        waitlistBuilder.build(ctx, scope, fixture.contactMeta());

        // ========== COMMUNICATIONS ==========
        log.info(" Emails: {}, threads: {}, drafts: {}",
            fixture.emails().size(), fixture.threads().size(), fixture.drafts().size());
        emailBuilder.build(ctx, scope, fixture, ownerId);
        messageThreadBuilder.build(ctx, scope, fixture.threads(), marketplaceUsers);
        draftBuilder.build(ctx, scope, fixture, ownerId);

        return scope;
    }

    /**
     * Positions in the fixture lists become index handles, so "contact #2" resolves to the
     * third contact of this tenant.
     */
    private void indexHandles(SeedContext ctx, TenantScope scope, TenantFixture fixture) {
        long tenantId = scope.tenantId();
        ReferenceResolver resolver = ctx.resolver();
        resolver.indexFixtures(tenantId, RefKind.ORGANIZATION_PARTY, fixture.organizations().stream()
            .map(OrganizationFixture::name)
            .map(name -> Handle.named(scope.name(name)))
            .toList());
        resolver.indexFixtures(tenantId, RefKind.CONTACT_PARTY, fixture.contacts().stream()
            .map(ContactFixture::email)
            .map(email -> Handle.named(scope.email(email)))
            .toList());
        resolver.indexFixtures(tenantId, RefKind.BREEDING_PLAN, fixture.breedingPlans().stream()
            .map(BreedingPlanFixture::name)
            .map(name -> Handle.named(scope.name(name)))
            .toList());
    }
}
