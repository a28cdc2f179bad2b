package com.tenantseed.service;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.SeedReport;
import com.tenantseed.model.SeedTally;
import com.tenantseed.model.TenantFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs the end-of-run summary: created/existing counts per kind, totals and any tenant failures.
 */
@Component
public class SeedReportPrinter {

    private static final Logger log = LoggerFactory.getLogger(SeedReportPrinter.class);

    public void print(SeedReport report) {
        SeedTally tally = report.tally();
        log.info("================ SEED SUMMARY ({}) ================", report.environment());
        log.info(String.format("%-20s %8s %8s", "Kind", "Created", "Existing"));
        for (EntityKind kind : EntityKind.values()) {
            int created = tally.created(kind);
            int existing = tally.existing(kind);
            if (created == 0 && existing == 0) {
                continue;
            }
            log.info(String.format("%-20s %8d %8d", kind.label(), created, existing));
        }
        log.info(String.format("%-20s %8d %8d", "TOTAL", tally.totalCreated(), tally.totalExisting()));
        log.info("Tenants processed: {}", report.tenantsProcessed());

        if (report.succeeded()) {
            log.info("All tenants seeded successfully");
            return;
        }
        log.warn("{} tenant(s) failed:", report.failures().size());
        for (TenantFailure failure : report.failures()) {
            log.warn("  - {}: {}", failure.tenantSlug(), failure.message());
        }
    }
}
