package com.tenantseed.repository;

import com.tenantseed.model.fixture.BreedingPlanFixture;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

@Repository
public class BreedingPlanRepository {

    private final JdbcTemplate jdbc;

    public BreedingPlanRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findIdByName(long tenantId, String name) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM breeding_plan WHERE tenant_id = ? AND name = ?", Long.class, tenantId, name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long tenantId, String name, long damId, long sireId, BreedingPlanFixture plan,
                     Instant committedAt) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO breeding_plan (tenant_id, name, nickname, species, breed_text, dam_id, sire_id,
                                       status, notes, expected_cycle_start, committed_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, name, plan.nickname(), plan.species(), plan.breedText(), damId, sireId,
            plan.status().name(), plan.notes(), plan.expectedCycleStart(), timestamp(committedAt)
        );
    }
}
