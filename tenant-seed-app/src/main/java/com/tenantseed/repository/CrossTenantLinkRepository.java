package com.tenantseed.repository;

import com.tenantseed.model.LineageParentType;
import com.tenantseed.model.LinkMethod;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

/**
 * Sire and dam links that cross tenant boundaries. An animal has at most one link per parent type.
 */
@Repository
public class CrossTenantLinkRepository {

    private final JdbcTemplate jdbc;

    public CrossTenantLinkRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findId(long childAnimalId, LineageParentType parentType) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM cross_tenant_animal_link WHERE child_animal_id = ? AND parent_type = ?",
            Long.class, childAnimalId, parentType.name()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long childAnimalId, long childTenantId, long parentAnimalId, long parentTenantId,
                     LineageParentType parentType, LinkMethod linkMethod, Instant createdAt) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO cross_tenant_animal_link (child_animal_id, child_tenant_id, parent_animal_id,
                                                  parent_tenant_id, parent_type, link_method, active, created_at)
            VALUES (?, ?, ?, ?, ?, ?, TRUE, ?)
            """,
            childAnimalId, childTenantId, parentAnimalId, parentTenantId, parentType.name(), linkMethod.name(),
            timestamp(createdAt)
        );
    }
}
