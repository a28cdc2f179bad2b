package com.tenantseed.service.builder;

import com.tenantseed.exception.UnresolvedReferenceException;
import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.OffspringFinancialState;
import com.tenantseed.model.OffspringPlacementState;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.SeededLitter;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.OffspringFixture;
import com.tenantseed.model.fixture.OffspringGroupFixture;
import com.tenantseed.repository.OffspringRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Offspring groups (litters) of a resolved dam and sire, with their offspring.
 * <p>
 * A new group and all of its offspring are written in one transaction. When the group already
 * exists each offspring is looked up on its own, so one removed since the last run is put back.
 * A group whose parents cannot be found is skipped with a warning.
 */
@Component
public class OffspringGroupBuilder {

    private static final Logger log = LoggerFactory.getLogger(OffspringGroupBuilder.class);

    private final OffspringRepository offspring;

    public OffspringGroupBuilder(OffspringRepository offspring) {
        this.offspring = offspring;
    }

    /**
     * @return the seeded groups in fixture order, without the skipped ones
     */
    public List<SeededLitter> build(SeedContext ctx, TenantScope scope, List<OffspringGroupFixture> groups) {
        List<SeededLitter> seeded = new ArrayList<>();
        for (OffspringGroupFixture group : groups) {
            try {
                seeded.add(seed(ctx, scope, group));
            } catch (UnresolvedReferenceException e) {
                log.warn("  ! Skipping offspring group {}: {}", group.name(), e.getMessage());
            }
        }
        return seeded;
    }

    private SeededLitter seed(SeedContext ctx, TenantScope scope, OffspringGroupFixture group) {
        long tenantId = scope.tenantId();
        String name = scope.name(group.name());
        long damId = ctx.resolver().require(tenantId, RefKind.ANIMAL,
            Handle.named(group.species(), scope.name(group.damRef())));
        long sireId = ctx.resolver().require(tenantId, RefKind.ANIMAL,
            Handle.named(group.species(), scope.name(group.sireRef())));

        UpsertResult result = ctx.upsert().upsert(EntityKind.OFFSPRING_GROUP, tenantId, name, group,
            () -> Lookup.of(offspring.findGroupId(tenantId, name)),
            () -> {
                long groupId = offspring.saveGroup(tenantId, name, damId, sireId, group);
                for (OffspringFixture child : group.offspring()) {
                    saveOffspring(scope, groupId, group, child, damId, sireId);
                }
                return groupId;
            });

        long groupId = result.id();
        List<Long> ids = new ArrayList<>();
        for (OffspringFixture child : group.offspring()) {
            String childName = scope.name(child.name());
            if (result.created()) {
                ctx.tally().recordCreated(EntityKind.OFFSPRING);
                ids.add(offspring.findId(groupId, childName).orElseThrow(() ->
                    new IllegalStateException("Offspring " + childName + " missing after creating " + name)));
            } else {
                UpsertResult childResult = ctx.upsert().upsert(EntityKind.OFFSPRING, tenantId,
                    name + " / " + childName, child,
                    () -> Lookup.of(offspring.findId(groupId, childName)),
                    () -> saveOffspring(scope, groupId, group, child, damId, sireId));
                ids.add(childResult.id());
            }
        }
        return new SeededLitter(groupId, group, ids);
    }

    private long saveOffspring(TenantScope scope, long groupId, OffspringGroupFixture group,
                               OffspringFixture child, long damId, long sireId) {
        LocalDate bornOn = group.actualBirthOn();
        LocalDate completedOn = group.placementCompletedAt();
        LocalDate placedOn = child.placementState() == OffspringPlacementState.PLACED ? completedOn : null;
        LocalDate paidOn = child.financialState() == OffspringFinancialState.PAID_IN_FULL ? completedOn : null;
        return offspring.save(scope.tenantId(), groupId, scope.name(child.name()), group.species(),
            damId, sireId, child, bornOn, child.hasCollar() ? bornOn : null, placedOn, paidOn);
    }
}
