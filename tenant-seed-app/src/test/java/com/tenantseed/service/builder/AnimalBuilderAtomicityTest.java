package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.SeedEnvironment;
import com.tenantseed.model.SeedReport;
import com.tenantseed.repository.AnimalRepository;
import com.tenantseed.service.SeedOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;

@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@Sql(scripts = "/clean-schema.sql", executionPhase = Sql.ExecutionPhase.BEFORE_TEST_METHOD)
class AnimalBuilderAtomicityTest {

    @Autowired
    private SeedOrchestrator orchestrator;

    @Autowired
    private JdbcTemplate jdbc;

    @SpyBean
    private AnimalRepository animals;

    @Test
    void failedGeneticsInsertLeavesNoAnimalBehind() {
        doThrow(new DataIntegrityViolationException("genetics insert failed"))
            .when(animals).saveGenetics(anyLong(), any(), any(), any(), any(), any(), any(), any());

        SeedReport report = orchestrator.run(SeedEnvironment.DEV);

        assertThat(report.succeeded()).isFalse();
        assertThat(report.failures()).singleElement()
            .satisfies(failure -> assertThat(failure.tenantSlug()).isEqualTo("dev-shire"));
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM animal", Integer.class)).isZero();
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM animal_privacy_settings", Integer.class)).isZero();
    }

    @Test
    void workBeforeTheFailingAnimalIsKept() {
        doThrow(new DataIntegrityViolationException("genetics insert failed"))
            .when(animals).saveGenetics(anyLong(), any(), any(), any(), any(), any(), any(), any());

        orchestrator.run(SeedEnvironment.DEV);

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM contact", Integer.class)).isEqualTo(3);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM organization", Integer.class)).isEqualTo(1);
    }

    @Test
    void rerunAfterFailureCreatesAnimalsFresh() {
        doThrow(new DataIntegrityViolationException("genetics insert failed"))
            .when(animals).saveGenetics(anyLong(), any(), any(), any(), any(), any(), any(), any());
        orchestrator.run(SeedEnvironment.DEV);
        reset(animals);

        SeedReport report = orchestrator.run(SeedEnvironment.DEV);

        assertThat(report.succeeded()).isTrue();
        assertThat(report.tally().created(EntityKind.ANIMAL)).isEqualTo(6);
        assertThat(report.tally().existing(EntityKind.ANIMAL)).isZero();
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM animal_genetics", Integer.class)).isEqualTo(6);
    }
}
