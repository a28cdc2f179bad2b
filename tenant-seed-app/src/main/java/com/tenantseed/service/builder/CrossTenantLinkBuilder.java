package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.PrivacySettings;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.fixture.CrossTenantLinkFixture;
import com.tenantseed.repository.AnimalRepository;
import com.tenantseed.repository.CrossTenantLinkRepository;
import com.tenantseed.repository.TenantRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Sire and dam links between animals of different tenants, seeded once every tenant exists.
 * <p>
 * Both animals must have cross-tenant matching allowed in their privacy settings. A link whose
 * tenants or animals cannot be found, or whose animals do not allow matching, is skipped with
 * a warning.
 */
@Component
public class CrossTenantLinkBuilder {

    private static final Logger log = LoggerFactory.getLogger(CrossTenantLinkBuilder.class);

    private final TenantRepository tenants;
    private final AnimalRepository animals;
    private final CrossTenantLinkRepository links;
    private final Clock clock;

    public CrossTenantLinkBuilder(TenantRepository tenants, AnimalRepository animals,
                                  CrossTenantLinkRepository links, Clock clock) {
        this.tenants = tenants;
        this.animals = animals;
        this.links = links;
        this.clock = clock;
    }

    public void build(SeedContext ctx, List<CrossTenantLinkFixture> fixtures) {
        for (CrossTenantLinkFixture link : fixtures) {
            seed(ctx, link);
        }
    }

    private void seed(SeedContext ctx, CrossTenantLinkFixture link) {
        SeedEnvironment env = ctx.environment();
        Optional<Long> childTenant = tenants.findIdBySlug(env.qualifySlug(link.childTenantSlug()));
        Optional<Long> parentTenant = tenants.findIdBySlug(env.qualifySlug(link.parentTenantSlug()));
        if (childTenant.isEmpty() || parentTenant.isEmpty()) {
            log.warn("  ! Skipping link {} <- {}: tenant {} not found", link.childAnimalRef(), link.parentAnimalRef(),
                childTenant.isEmpty() ? link.childTenantSlug() : link.parentTenantSlug());
            return;
        }

        Lookup child = ctx.resolver().resolve(childTenant.get(), RefKind.ANIMAL,
            Handle.named(link.species(), env.qualifyName(link.childAnimalRef())));
        Lookup parent = ctx.resolver().resolve(parentTenant.get(), RefKind.ANIMAL,
            Handle.named(link.species(), env.qualifyName(link.parentAnimalRef())));
        if (!child.isFound() || !parent.isFound()) {
            log.warn("  ! Skipping link {} <- {}: animal {} not found", link.childAnimalRef(), link.parentAnimalRef(),
                child.isFound() ? link.parentAnimalRef() : link.childAnimalRef());
            return;
        }
        if (!allowsMatching(child.getId()) || !allowsMatching(parent.getId())) {
            log.warn("  ! Skipping link {} <- {}: cross-tenant matching is turned off",
                link.childAnimalRef(), link.parentAnimalRef());
            return;
        }

        long childId = child.getId();
        long parentId = parent.getId();
        // An animal has one link per parent type, so the child and the type form the key.
        ctx.upsert().upsert(EntityKind.CROSS_TENANT_LINK, childTenant.get(),
            link.parentType() + " of " + link.species() + " " + link.childAnimalRef(), link,
            () -> Lookup.of(links.findId(childId, link.parentType())),
            () -> links.save(childId, childTenant.get(), parentId, parentTenant.get(), link.parentType(),
                link.linkMethod(), clock.instant()));
    }

    private boolean allowsMatching(long animalId) {
        return animals.findPrivacy(animalId)
            .map(PrivacySettings::allowCrossTenantMatching)
            .orElse(false);
    }
}
