package com.tenantseed.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

/**
 * Party emails and the activity-feed rows that accompany them.
 */
@Repository
public class EmailRepository {

    private final JdbcTemplate jdbc;

    public EmailRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findId(long tenantId, long partyId, String subject) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM party_email WHERE tenant_id = ? AND party_id = ? AND subject = ?",
            Long.class, tenantId, partyId, subject
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long saveEmail(long tenantId, long partyId, String subject, String body, String toEmail,
                          Instant sentAt, String status, boolean read, Long createdBy) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO party_email (tenant_id, party_id, subject, body, to_email, sent_at, status,
                                     is_read, created_by)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, partyId, subject, body, toEmail, timestamp(sentAt), status, read, createdBy
        );
    }

    public long saveActivity(long tenantId, long partyId, String kind, String title, String detail,
                             Instant createdAt) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO party_activity (tenant_id, party_id, kind, title, detail, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            tenantId, partyId, kind, title, detail, timestamp(createdAt)
        );
    }
}
