package com.tenantseed.repository;

import com.tenantseed.model.PartyType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class PartyRepository {

    private final JdbcTemplate jdbc;

    public PartyRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long save(long tenantId, PartyType type, String name, String email, String phone,
                     String city, String state, String country) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO party (tenant_id, party_type, name, email, phone, city, state, country)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, type.name(), name, email, phone, city, state, country
        );
    }

    public Optional<Long> findIdByEmail(long tenantId, String email) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM party WHERE tenant_id = ? AND email = ? ORDER BY id",
            Long.class, tenantId, email
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
