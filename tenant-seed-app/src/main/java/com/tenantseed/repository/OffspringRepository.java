package com.tenantseed.repository;

import com.tenantseed.model.fixture.OffspringFixture;
import com.tenantseed.model.fixture.OffspringGroupFixture;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Offspring groups (litters) and the individual offspring born into them.
 */
@Repository
public class OffspringRepository {

    private final JdbcTemplate jdbc;

    public OffspringRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findGroupId(long tenantId, String name) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM offspring_group WHERE tenant_id = ? AND name = ?", Long.class, tenantId, name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long saveGroup(long tenantId, String name, long damId, long sireId, OffspringGroupFixture group) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO offspring_group (tenant_id, name, species, dam_id, sire_id, actual_birth_on,
                                         count_born, count_live, count_stillborn, count_male, count_female,
                                         count_weaned, count_placed, weaned_at, placement_completed_at, notes)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, name, group.species(), damId, sireId, group.actualBirthOn(),
            group.countBorn(), group.countLive(), group.countStillborn(), group.countMale(), group.countFemale(),
            group.countWeaned(), group.countPlaced(), group.weanedAt(), group.placementCompletedAt(), group.notes()
        );
    }

    public Optional<Long> findId(long groupId, String name) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM offspring WHERE group_id = ? AND name = ?", Long.class, groupId, name);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long tenantId, long groupId, String name, String species, long damId, long sireId,
                     OffspringFixture offspring, LocalDate bornOn, LocalDate collarAssignedOn,
                     LocalDate placedOn, LocalDate paidInFullOn) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO offspring (tenant_id, group_id, name, species, breed, sex, born_at, dam_id, sire_id,
                                   life_state, placement_state, keeper_intent, financial_state, paperwork_state,
                                   collar_color_name, collar_color_hex, collar_assigned_at, price_cents,
                                   deposit_cents, notes, placed_at, paid_in_full_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, groupId, name, species, offspring.breed(), offspring.sex(), bornOn, damId, sireId,
            offspring.lifeState().name(), offspring.placementState().name(), offspring.keeperIntent().name(),
            offspring.financialState().name(), offspring.paperworkState().name(),
            offspring.collarColorName(), offspring.collarColorHex(), collarAssignedOn, offspring.priceCents(),
            offspring.depositCents(), offspring.notes(), placedOn, paidInFullOn
        );
    }
}
