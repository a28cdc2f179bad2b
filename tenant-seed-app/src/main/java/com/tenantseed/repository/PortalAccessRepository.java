package com.tenantseed.repository;

import com.tenantseed.model.PortalAccess;
import com.tenantseed.model.PortalAccessStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

@Repository
public class PortalAccessRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<PortalAccess> ROW_MAPPER = (rs, rowNum) -> new PortalAccess(
        rs.getLong("id"),
        rs.getLong("party_id"),
        PortalAccessStatus.valueOf(rs.getString("status")),
        JdbcInserts.nullableLong(rs, "user_id")
    );

    public PortalAccessRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<PortalAccess> findByParty(long partyId) {
        List<PortalAccess> results = jdbc.query(
            "SELECT id, party_id, status, user_id FROM portal_access WHERE party_id = ?",
            ROW_MAPPER, partyId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long tenantId, long partyId, Long userId, Instant invitedAt, Instant activatedAt) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO portal_access (tenant_id, party_id, status, user_id, invited_at, activated_at)
            VALUES (?, ?, 'ACTIVE', ?, ?, ?)
            """,
            tenantId, partyId, userId, timestamp(invitedAt), timestamp(activatedAt)
        );
    }

    /**
     * Links a user to an access row that has none yet and activates it.
     *
     * @return true if the row was changed
     */
    public boolean linkUser(long id, long userId, Instant activatedAt) {
        return jdbc.update("""
            UPDATE portal_access SET user_id = ?, status = 'ACTIVE', activated_at = ?
            WHERE id = ? AND user_id IS NULL
            """,
            userId, timestamp(activatedAt), id
        ) > 0;
    }
}
