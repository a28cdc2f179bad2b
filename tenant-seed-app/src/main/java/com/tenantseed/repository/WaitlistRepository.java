package com.tenantseed.repository;

import com.tenantseed.model.WaitlistStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

@Repository
public class WaitlistRepository {

    private final JdbcTemplate jdbc;

    public WaitlistRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findId(long tenantId, long clientPartyId, long planId) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM waitlist_entry WHERE tenant_id = ? AND client_party_id = ? AND plan_id = ?",
            Long.class, tenantId, clientPartyId, planId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long tenantId, long clientPartyId, long planId, int priority, WaitlistStatus status,
                     int depositRequiredCents, int depositPaidCents, Instant depositPaidAt, Instant approvedAt,
                     String notes) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO waitlist_entry (tenant_id, client_party_id, plan_id, priority, status,
                deposit_required_cents, deposit_paid_cents, deposit_paid_at, approved_at, notes)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, clientPartyId, planId, priority, status.name(), depositRequiredCents,
            depositPaidCents, timestamp(depositPaidAt), timestamp(approvedAt), notes
        );
    }
}
