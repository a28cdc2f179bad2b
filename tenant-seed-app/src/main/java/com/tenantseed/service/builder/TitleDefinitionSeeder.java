package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Handle;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.RefKind;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.TitleDefinitionFixture;
import com.tenantseed.repository.TitleDefinitionRepository;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global title definitions shared by all tenants. Definitions are created first and linked to
 * their prerequisite titles in a second pass, so declaration order does not matter.
 * When two organizations share an abbreviation for one species, references by abbreviation
 * resolve to the first declared definition.
 */
@Component
public class TitleDefinitionSeeder {

    private static final Logger log = LoggerFactory.getLogger(TitleDefinitionSeeder.class);

    private final TitleDefinitionRepository titleDefinitions;

    public TitleDefinitionSeeder(TitleDefinitionRepository titleDefinitions) {
        this.titleDefinitions = titleDefinitions;
    }

    public void seed(SeedContext ctx, List<TitleDefinitionFixture> definitions) {
        List<Long> ids = new ArrayList<>();
        Map<Handle, TitleDefinitionFixture> registered = new HashMap<>();
        for (TitleDefinitionFixture definition : definitions) {
            String key = definition.species() + " " + definition.abbreviation() + " (" + definition.organization() + ")";
            UpsertResult result = ctx.upsert().upsert(EntityKind.TITLE_DEFINITION, null, key, definition,
                () -> Lookup.of(titleDefinitions.findId(definition.species(), definition.abbreviation(),
                    definition.organization())),
                () -> titleDefinitions.save(definition));
            Handle handle = Handle.named(definition.species(), definition.abbreviation());
            TitleDefinitionFixture first = registered.putIfAbsent(handle, definition);
            if (first == null) {
                ctx.resolver().register(0L, RefKind.TITLE_DEFINITION, handle, result.id());
            } else {
                log.warn("  ! {} {} is defined by both {} and {}; animal titles resolve to {}",
                    definition.species(), definition.abbreviation(), first.organization(),
                    definition.organization(), first.organization());
            }
            ids.add(result.id());
        }

        for (int i = 0; i < definitions.size(); i++) {
            TitleDefinitionFixture definition = definitions.get(i);
            if (definition.prerequisiteTitle() == null) {
                continue;
            }
            Lookup parent = ctx.resolver().resolve(0L, RefKind.TITLE_DEFINITION,
                Handle.named(definition.species(), definition.prerequisiteTitle()));
            if (!parent.isFound()) {
                log.warn("  ! Prerequisite {} not found for {} {}", definition.prerequisiteTitle(),
                    definition.species(), definition.abbreviation());
                continue;
            }
            if (titleDefinitions.updateParent(ids.get(i), parent.getId())) {
                log.info("    ~ Linked {} {} to prerequisite {}", definition.species(),
                    definition.abbreviation(), definition.prerequisiteTitle());
            }
        }
    }
}
