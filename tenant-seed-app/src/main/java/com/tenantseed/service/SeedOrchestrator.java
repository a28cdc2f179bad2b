package com.tenantseed.service;

import com.tenantseed.exception.SeedSetupException;
import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.SeedReport;
import com.tenantseed.model.TenantFailure;
import com.tenantseed.model.fixture.SeedCatalogue;
import com.tenantseed.model.fixture.TenantFixture;
import com.tenantseed.model.fixture.TitleDefinitionFixture;
import com.tenantseed.service.builder.CrossTenantLinkBuilder;
import com.tenantseed.service.builder.TitleDefinitionSeeder;
import com.tenantseed.service.builder.UserBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a whole catalogue for one environment.
 * <p>
 * Title definitions and marketplace users are global and seeded first; a failure there aborts
 * the run with {@link SeedSetupException}. Tenants are then seeded in catalogue order, and a
 * tenant that fails is recorded in the report without stopping the ones after it. Links between
 * animals of different tenants come last, once every tenant exists.
 */
@Service
public class SeedOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SeedOrchestrator.class);

    /** Failure label for the cross-tenant link pass, which belongs to no single tenant. */
    static final String CROSS_TENANT_LINKS = "cross-tenant-links";

    private final FixtureCatalogueLoader loader;
    private final SeedContextFactory contextFactory;
    private final TitleDefinitionSeeder titleDefinitionSeeder;
    private final UserBuilder userBuilder;
    private final TenantSeeder tenantSeeder;
    private final CrossTenantLinkBuilder crossTenantLinkBuilder;

    public SeedOrchestrator(FixtureCatalogueLoader loader,
                            SeedContextFactory contextFactory,
                            TitleDefinitionSeeder titleDefinitionSeeder,
                            UserBuilder userBuilder,
                            TenantSeeder tenantSeeder,
                            CrossTenantLinkBuilder crossTenantLinkBuilder) {
        this.loader = loader;
        this.contextFactory = contextFactory;
        this.titleDefinitionSeeder = titleDefinitionSeeder;
        this.userBuilder = userBuilder;
        this.tenantSeeder = tenantSeeder;
        this.crossTenantLinkBuilder = crossTenantLinkBuilder;
    }

    public SeedReport run(SeedEnvironment env) {
        return run(env, loader.loadCatalogue(env), loader.loadTitleDefinitions());
    }

    public SeedReport run(SeedEnvironment env, SeedCatalogue catalogue, List<TitleDefinitionFixture> titleDefinitions) {
        log.info("Seeding {} environment: {} tenants", env, catalogue.tenants().size());
        SeedContext ctx = contextFactory.newContext(env);

        try {
            log.info("Title definitions: {}", titleDefinitions.size());
            titleDefinitionSeeder.seed(ctx, titleDefinitions);
        } catch (RuntimeException e) {
            throw new SeedSetupException("Failed to seed title definitions", e);
        }
        try {
            log.info("Marketplace users: {}", catalogue.marketplaceUsers().size());
            userBuilder.seedMarketplaceUsers(ctx, catalogue.marketplaceUsers());
        } catch (RuntimeException e) {
            throw new SeedSetupException("Failed to seed marketplace users", e);
        }

        List<TenantFailure> failures = new ArrayList<>();
        int processed = 0;
        for (TenantFixture tenant : catalogue.tenants()) {
            String slug = env.qualifySlug(tenant.slug());
            processed++;
            try {
                tenantSeeder.seed(ctx, tenant, catalogue.marketplaceUsers());
            } catch (RuntimeException e) {
                log.error("Tenant {} failed: {}", slug, e.getMessage(), e);
                failures.add(new TenantFailure(slug, e.getMessage()));
            }
        }

        try {
            log.info("Cross-tenant links: {}", catalogue.crossTenantLinks().size());
            crossTenantLinkBuilder.build(ctx, catalogue.crossTenantLinks());
        } catch (RuntimeException e) {
            log.error("Cross-tenant links failed: {}", e.getMessage(), e);
            failures.add(new TenantFailure(CROSS_TENANT_LINKS, e.getMessage()));
        }

        return new SeedReport(env, processed, ctx.tally(), failures);
    }
}
