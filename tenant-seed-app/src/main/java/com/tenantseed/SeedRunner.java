package com.tenantseed;

import com.tenantseed.config.SeedProperties;
import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.SeedReport;
import com.tenantseed.service.CredentialsReport;
import com.tenantseed.service.FixtureCatalogueLoader;
import com.tenantseed.service.SeedOrchestrator;
import com.tenantseed.service.SeedReportPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Command-line entry. Seeds the configured environment, or with the {@code credentials}
 * argument only prints the credentials sheet. Exits 1 if any tenant failed or the run aborted.
 */
@Component
@ConditionalOnProperty(name = "tenantseed.run-on-startup", havingValue = "true", matchIfMissing = true)
public class SeedRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SeedRunner.class);

    private final SeedProperties properties;
    private final SeedOrchestrator orchestrator;
    private final SeedReportPrinter printer;
    private final FixtureCatalogueLoader loader;
    private final CredentialsReport credentialsReport;

    private int exitCode;

    public SeedRunner(SeedProperties properties, SeedOrchestrator orchestrator, SeedReportPrinter printer,
                      FixtureCatalogueLoader loader, CredentialsReport credentialsReport) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.printer = printer;
        this.loader = loader;
        this.credentialsReport = credentialsReport;
    }

    @Override
    public void run(String... args) {
        SeedEnvironment env = properties.resolveEnvironment();
        if (Arrays.asList(args).contains("credentials")) {
            log.info("\n{}", credentialsReport.render(loader.loadCatalogue(env), env));
            return;
        }

        try {
            SeedReport report = orchestrator.run(env);
            printer.print(report);
            log.info("\n{}", credentialsReport.render(loader.loadCatalogue(env), env));
            exitCode = report.succeeded() ? 0 : 1;
        } catch (RuntimeException e) {
            log.error("Seeding aborted: {}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
