package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.fixture.AnimalFixture;
import com.tenantseed.model.fixture.AnimalTitleFixture;
import com.tenantseed.model.fixture.CompetitionFixture;
import com.tenantseed.repository.AnimalTitleRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Earned titles and competition entries. A title whose definition is missing is skipped with
 * a warning; the rest of the animal's record still gets seeded.
 */
@Component
public class TitleBuilder {

    private static final Logger log = LoggerFactory.getLogger(TitleBuilder.class);

    private final AnimalTitleRepository animalTitles;

    public TitleBuilder(AnimalTitleRepository animalTitles) {
        this.animalTitles = animalTitles;
    }

    public void build(SeedContext ctx, TenantScope scope, List<AnimalFixture> animals) {
        for (AnimalFixture animal : animals) {
            if (animal.titles().isEmpty() && animal.competitions().isEmpty()) {
                continue;
            }
            String name = scope.name(animal.name());
            Lookup animalId = ctx.resolver().resolve(scope.tenantId(), RefKind.ANIMAL,
                Handle.named(animal.species(), name));
            if (!animalId.isFound()) {
                log.warn("  ! Animal not found for titles: {}", name);
                continue;
            }
            for (AnimalTitleFixture title : animal.titles()) {
                seedTitle(ctx, scope, animal, name, animalId.getId(), title);
            }
            for (CompetitionFixture entry : animal.competitions()) {
                seedCompetition(ctx, scope, name, animalId.getId(), entry);
            }
        }
    }

    private void seedTitle(SeedContext ctx, TenantScope scope, AnimalFixture animal, String animalName,
                           long animalId, AnimalTitleFixture title) {
        Lookup definition = ctx.resolver().resolve(scope.tenantId(), RefKind.TITLE_DEFINITION,
            Handle.named(animal.species(), title.titleAbbreviation()));
        if (!definition.isFound()) {
            log.warn("  ! Title definition not found: {} {} (for {})", animal.species(),
                title.titleAbbreviation(), animalName);
            return;
        }
        long definitionId = definition.getId();
        ctx.upsert().upsert(EntityKind.ANIMAL_TITLE, scope.tenantId(),
            title.titleAbbreviation() + " for " + animalName, title,
            () -> Lookup.of(animalTitles.findTitleId(animalId, definitionId)),
            () -> animalTitles.saveTitle(animalId, definitionId, title));
    }

    private void seedCompetition(SeedContext ctx, TenantScope scope, String animalName, long animalId,
                                 CompetitionFixture entry) {
        ctx.upsert().upsert(EntityKind.COMPETITION_ENTRY, scope.tenantId(),
            entry.eventName() + " " + entry.eventDate() + " for " + animalName, entry,
            () -> Lookup.of(animalTitles.findCompetitionId(animalId, entry.eventName(), entry.eventDate())),
            () -> animalTitles.saveCompetition(animalId, entry));
    }
}
