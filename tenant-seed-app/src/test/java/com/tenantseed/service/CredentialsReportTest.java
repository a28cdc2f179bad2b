package com.tenantseed.service;

import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.fixture.MarketplaceVisibility;
import com.tenantseed.model.fixture.SeedCatalogue;
import com.tenantseed.model.fixture.TenantFixture;
import com.tenantseed.model.fixture.ThemeFixture;
import com.tenantseed.model.fixture.UserFixture;
import com.tenantseed.model.fixture.VisibilityPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialsReportTest {

    private final CredentialsReport report = new CredentialsReport();

    @Test
    void listsOwnerLoginPerTenant() {
        String text = report.render(catalogue(), SeedEnvironment.PROD);

        assertThat(text)
            .contains("VALIDATION TENANT CREDENTIALS - PROD ENVIRONMENT")
            .contains("TENANT: [PROD] Ted Lasso")
            .contains("Slug:     prod-richmond")
            .contains("Species:  DOG, HORSE")
            .contains("Email:    ted.prod@afcrichmond.local")
            .contains("Password: Richmond123!");
    }

    @Test
    void rendersFlagsAsYesNo() {
        String text = report.render(catalogue(), SeedEnvironment.DEV);

        assertThat(text)
            .contains("Public Program: No")
            .contains("Programs Enabled: 0")
            .contains("Cross-Tenant Matching: Yes")
            .contains("Show Genetics: No");
    }

    @Test
    void listsMarketplaceUsers() {
        String text = report.render(catalogue(), SeedEnvironment.DEV);

        assertThat(text).contains("MARKETPLACE USERS").contains("chani.dev@sietch.local");
    }

    private static SeedCatalogue catalogue() {
        TenantFixture richmond = new TenantFixture(
            "richmond",
            new ThemeFixture("tedlasso", "Ted Lasso", "#00529F", "#FFD700", "#DC143C", "AFC Richmond"),
            new MarketplaceVisibility(false, false, 0, 1),
            new VisibilityPolicy(true, true, true, false, false, true, false, true, true, false),
            List.of("DOG", "HORSE"),
            new UserFixture("Ted", "Lasso", "ted@afcrichmond.local", "Richmond123!", false),
            null, null, null, null, null, null, null, null, null, null, null);
        return new SeedCatalogue(
            List.of(new UserFixture("Chani", "Kynes", "chani@sietch.local", "Marketplace123!", false)),
            List.of(richmond),
            null);
    }
}
