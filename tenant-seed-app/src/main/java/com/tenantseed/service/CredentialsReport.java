package com.tenantseed.service;

import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.fixture.MarketplaceVisibility;
import com.tenantseed.model.fixture.SeedCatalogue;
import com.tenantseed.model.fixture.TenantFixture;
import com.tenantseed.model.fixture.UserFixture;
import com.tenantseed.model.fixture.VisibilityPolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text sheet of the login credentials a catalogue seeds, for handing to testers.
 */
@Component
public class CredentialsReport {

    private static final String HEAVY_RULE = "=".repeat(79);
    private static final String LIGHT_RULE = "-".repeat(77);

    public String render(SeedCatalogue catalogue, SeedEnvironment env) {
        List<String> lines = new ArrayList<>();
        lines.add(HEAVY_RULE);
        lines.add("VALIDATION TENANT CREDENTIALS - " + env.prefix() + " ENVIRONMENT");
        lines.add(HEAVY_RULE);
        lines.add("");

        for (TenantFixture tenant : catalogue.tenants()) {
            UserFixture owner = tenant.owner();
            MarketplaceVisibility marketplace = tenant.marketplaceVisibility();
            VisibilityPolicy visibility = tenant.lineageVisibility();

            lines.add(LIGHT_RULE);
            lines.add("TENANT: " + env.qualifyName(tenant.theme().name()));
            lines.add(LIGHT_RULE);
            lines.add("  Slug:     " + env.qualifySlug(tenant.slug()));
            lines.add("  Theme:    " + tenant.theme().name());
            lines.add("  Species:  " + String.join(", ", tenant.species()));
            lines.add("");
            lines.add("  OWNER/ADMIN:");
            lines.add("    Name:     " + owner.fullName());
            lines.add("    Email:    " + env.qualifyEmail(owner.email()));
            lines.add("    Password: " + owner.password());
            lines.add("");
            if (marketplace != null) {
                lines.add("  MARKETPLACE:");
                lines.add("    Public Program: " + yesNo(marketplace.publicProgram()));
                lines.add("    Active Listings: " + yesNo(marketplace.activeListings()));
                lines.add("    Programs Enabled: " + marketplace.programsEnabled());
                lines.add("");
            }
            if (visibility != null) {
                lines.add("  VISIBILITY:");
                lines.add("    Cross-Tenant Matching: " + yesNo(visibility.allowCrossTenantMatching()));
                lines.add("    Show Full DOB: " + yesNo(visibility.defaultShowFullDob()));
                lines.add("    Show Genetics: " + yesNo(visibility.defaultShowGeneticData()));
                lines.add("    Show Health: " + yesNo(visibility.defaultShowHealthResults()));
                lines.add("");
            }
        }

        if (!catalogue.marketplaceUsers().isEmpty()) {
            lines.add(LIGHT_RULE);
            lines.add("MARKETPLACE USERS");
            lines.add(LIGHT_RULE);
            for (UserFixture shopper : catalogue.marketplaceUsers()) {
                lines.add("  " + shopper.fullName() + "  " + env.qualifyEmail(shopper.email())
                    + "  / " + shopper.password());
            }
            lines.add("");
        }

        return String.join("\n", lines);
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }
}
