package com.tenantseed.service.builder;

import com.tenantseed.exception.UnresolvedLineageException;
import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.PrivacySettings;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.AnimalFixture;
import com.tenantseed.model.fixture.GeneticsFixture;
import com.tenantseed.repository.AnimalRepository;
import com.tenantseed.service.JsonWriter;
import com.tenantseed.service.SeedContext;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;

/**
 * Animals with their genetics panel and privacy settings, written together in one transaction.
 * Expects the list in generation order so parents already exist when their offspring is built.
 */
@Component
public class AnimalBuilder {

    static final int GENETICS_TEST_AGE_DAYS = 180;

    private final AnimalRepository animals;
    private final JsonWriter json;

    public AnimalBuilder(AnimalRepository animals, JsonWriter json) {
        this.animals = animals;
        this.json = json;
    }

    /**
     * @return animal ids in the order given
     * @throws UnresolvedLineageException if a declared sire or dam does not exist yet
     */
    public List<Long> build(SeedContext ctx, TenantScope scope, List<AnimalFixture> ordered) {
        List<Long> ids = new ArrayList<>();
        for (AnimalFixture animal : ordered) {
            ids.add(seed(ctx, scope, animal));
        }
        return ids;
    }

    long seed(SeedContext ctx, TenantScope scope, AnimalFixture animal) {
        long tenantId = scope.tenantId();
        String name = scope.name(animal.name());
        Long sireId = resolveParent(ctx, scope, animal, "sire", animal.sireRef());
        Long damId = resolveParent(ctx, scope, animal, "dam", animal.damRef());

        // Catalogues only carry a birth year.
        LocalDate birthDate = LocalDate.of(animal.birthYear(), Month.JUNE, 15);
        LocalDate testDate = animal.testProvider() == null ? null : birthDate.plusDays(GENETICS_TEST_AGE_DAYS);
        PrivacySettings privacy = PrivacySettings.defaultsFrom(scope.visibility())
            .withOverrides(animal.privacyOverrides());
        GeneticsFixture genetics = animal.genetics();

        UpsertResult result = ctx.upsert().upsert(EntityKind.ANIMAL, tenantId,
            name + " (" + animal.species() + ")", animal,
            () -> Lookup.of(animals.findId(tenantId, name, animal.species())),
            () -> {
                long id = animals.save(tenantId, name, animal.species(), animal.sex(), animal.breed(),
                    birthDate, animal.notes(), sireId, damId);
                animals.saveGenetics(id, animal.testProvider(), testDate,
                    json.write(genetics.coatColor()),
                    json.write(genetics.coatType()),
                    json.write(genetics.physicalTraits()),
                    json.write(genetics.eyeColor()),
                    json.write(genetics.health()));
                animals.savePrivacy(id, privacy);
                return id;
            });

        ctx.resolver().register(tenantId, RefKind.ANIMAL, Handle.named(animal.species(), name), result.id());
        return result.id();
    }

    private Long resolveParent(SeedContext ctx, TenantScope scope, AnimalFixture child, String role,
                               String parentRef) {
        if (parentRef == null) {
            return null;
        }
        Lookup parent = ctx.resolver().resolve(scope.tenantId(), RefKind.ANIMAL,
            Handle.named(child.species(), scope.name(parentRef)));
        if (!parent.isFound()) {
            throw new UnresolvedLineageException(child.name(), role, parentRef);
        }
        return parent.getId();
    }
}
