package com.tenantseed.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

@Repository
public class DraftRepository {

    private final JdbcTemplate jdbc;

    public DraftRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findId(long tenantId, String subject, String body) {
        List<Long> results;
        if (subject == null) {
            results = jdbc.queryForList(
                "SELECT id FROM draft WHERE tenant_id = ? AND subject IS NULL AND body_text = ?",
                Long.class, tenantId, body
            );
        } else {
            results = jdbc.queryForList(
                "SELECT id FROM draft WHERE tenant_id = ? AND subject = ? AND body_text = ?",
                Long.class, tenantId, subject, body
            );
        }
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long tenantId, Long partyId, String channel, String subject, String toAddresses,
                     String body, Long createdByUserId, Instant createdAt) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO draft (tenant_id, party_id, channel, subject, to_addresses, body_text,
                               created_by_user_id, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, partyId, channel, subject, toAddresses, body, createdByUserId, timestamp(createdAt)
        );
    }
}
