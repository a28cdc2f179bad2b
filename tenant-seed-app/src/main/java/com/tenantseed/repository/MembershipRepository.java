package com.tenantseed.repository;

import com.tenantseed.model.MembershipRole;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class MembershipRepository {

    private final JdbcTemplate jdbc;

    public MembershipRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findId(long userId, long tenantId) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM tenant_membership WHERE user_id = ? AND tenant_id = ?",
            Long.class, userId, tenantId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long userId, long tenantId, MembershipRole role, MembershipRole membershipRole) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO tenant_membership (user_id, tenant_id, role, membership_role, membership_status)
            VALUES (?, ?, ?, ?, 'ACTIVE')
            """,
            userId, tenantId, role.name(), membershipRole.name()
        );
    }
}
