package com.tenantseed.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

@Repository
public class TenantRepository {

    private final JdbcTemplate jdbc;

    public TenantRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findIdBySlug(String slug) {
        List<Long> results = jdbc.queryForList("SELECT id FROM tenant WHERE slug = ?", Long.class, slug);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(String slug, String name, Instant createdAt) {
        return JdbcInserts.insert(jdbc,
            "INSERT INTO tenant (slug, name, created_at) VALUES (?, ?, ?)",
            slug, name, timestamp(createdAt));
    }

    /**
     * Replaces the settings document for a namespace, inserting it the first time.
     *
     * @return true if a new row was inserted, false if an existing one was overwritten
     */
    public boolean saveSetting(long tenantId, String namespace, String settingsJson, Instant updatedAt) {
        int updated = jdbc.update("""
            UPDATE tenant_setting SET settings_json = ?, updated_at = ?
            WHERE tenant_id = ? AND namespace = ?
            """,
            settingsJson, timestamp(updatedAt), tenantId, namespace
        );
        if (updated > 0) {
            return false;
        }
        jdbc.update("""
            INSERT INTO tenant_setting (tenant_id, namespace, settings_json, updated_at)
            VALUES (?, ?, ?, ?)
            """,
            tenantId, namespace, settingsJson, timestamp(updatedAt)
        );
        return true;
    }
}
