package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.UpsertResult;
import com.tenantseed.model.fixture.TenantFixture;
import com.tenantseed.repository.TenantRepository;
import com.tenantseed.service.JsonWriter;
import com.tenantseed.service.SeedContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates the tenant row once and rewrites its theme and lineage-visibility settings on
 * every run.
 */
@Component
public class TenantBuilder {

    private static final Logger log = LoggerFactory.getLogger(TenantBuilder.class);

    static final String THEME = "theme";
    static final String LINEAGE_VISIBILITY = "lineage-visibility";

    private final TenantRepository tenants;
    private final JsonWriter json;
    private final Clock clock;

    public TenantBuilder(TenantRepository tenants, JsonWriter json, Clock clock) {
        this.tenants = tenants;
        this.json = json;
        this.clock = clock;
    }

    public TenantScope build(SeedContext ctx, TenantFixture fixture) {
        SeedEnvironment env = ctx.environment();
        String slug = env.qualifySlug(fixture.slug());
        String name = env.qualifyName(fixture.theme().name());

        UpsertResult tenant = ctx.upsert().upsert(EntityKind.TENANT, null, slug, name,
            () -> Lookup.of(tenants.findIdBySlug(slug)),
            () -> tenants.save(slug, name, clock.instant()));

        saveSetting(ctx, tenant.id(), THEME, fixture.theme());
        saveSetting(ctx, tenant.id(), LINEAGE_VISIBILITY, fixture.lineageVisibility());

        return new TenantScope(tenant.id(), fixture.slug(), env, fixture.lineageVisibility());
    }

    private void saveSetting(SeedContext ctx, long tenantId, String namespace, Object settings) {
        boolean created = tenants.saveSetting(tenantId, namespace, json.write(settings), clock.instant());
        if (created) {
            ctx.tally().recordCreated(EntityKind.TENANT_SETTING);
            log.info("  + Created setting: {}", namespace);
        } else {
            ctx.tally().recordExisting(EntityKind.TENANT_SETTING);
            log.info("  ~ Replaced setting: {}", namespace);
        }
    }
}
