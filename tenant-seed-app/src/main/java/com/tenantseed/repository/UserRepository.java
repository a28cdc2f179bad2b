package com.tenantseed.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

@Repository
public class UserRepository {

    private final JdbcTemplate jdbc;

    public UserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findIdByEmail(String email) {
        List<Long> results = jdbc.queryForList("SELECT id FROM app_user WHERE email = ?", Long.class, email);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(String email, String firstName, String lastName, String passwordHash,
                     boolean superAdmin, Instant emailVerifiedAt, Long defaultTenantId) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO app_user (email, first_name, last_name, password_hash, super_admin,
                                  email_verified_at, default_tenant_id)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            email, firstName, lastName, passwordHash, superAdmin, timestamp(emailVerifiedAt), defaultTenantId
        );
    }

    /**
     * Sets the default tenant only where none is set yet.
     *
     * @return true if the row was changed
     */
    public boolean backfillDefaultTenant(long userId, long tenantId) {
        return jdbc.update(
            "UPDATE app_user SET default_tenant_id = ? WHERE id = ? AND default_tenant_id IS NULL",
            tenantId, userId
        ) > 0;
    }
}
