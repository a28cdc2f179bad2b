package com.tenantseed.service.builder;

import com.tenantseed.exception.UnresolvedReferenceException;
import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.PlanStatus;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.BreedingPlanFixture;
import com.tenantseed.repository.BreedingPlanRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Breeding plans pairing a resolved dam and sire. A plan whose parents cannot be found is
 * skipped with a warning.
 */
@Component
public class BreedingPlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(BreedingPlanBuilder.class);

    private final BreedingPlanRepository plans;
    private final Clock clock;

    public BreedingPlanBuilder(BreedingPlanRepository plans, Clock clock) {
        this.plans = plans;
        this.clock = clock;
    }

    public void build(SeedContext ctx, TenantScope scope, List<BreedingPlanFixture> fixtures) {
        for (BreedingPlanFixture plan : fixtures) {
            try {
                seed(ctx, scope, plan);
            } catch (UnresolvedReferenceException e) {
                log.warn("  ! Skipping breeding plan {}: {}", plan.name(), e.getMessage());
            }
        }
    }

    private void seed(SeedContext ctx, TenantScope scope, BreedingPlanFixture plan) {
        long tenantId = scope.tenantId();
        String name = scope.name(plan.name());
        long damId = ctx.resolver().require(tenantId, RefKind.ANIMAL,
            Handle.named(plan.species(), scope.name(plan.damRef())));
        long sireId = ctx.resolver().require(tenantId, RefKind.ANIMAL,
            Handle.named(plan.species(), scope.name(plan.sireRef())));
        Instant committedAt = plan.status() == PlanStatus.COMMITTED ? clock.instant() : null;

        UpsertResult result = ctx.upsert().upsert(EntityKind.BREEDING_PLAN, tenantId, name, plan,
            () -> Lookup.of(plans.findIdByName(tenantId, name)),
            () -> plans.save(tenantId, name, damId, sireId, plan, committedAt));
        ctx.resolver().register(tenantId, RefKind.BREEDING_PLAN, Handle.named(name), result.id());
    }
}
