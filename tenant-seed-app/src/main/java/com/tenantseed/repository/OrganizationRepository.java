package com.tenantseed.repository;

import com.tenantseed.model.PartyLink;
import com.tenantseed.model.fixture.OrganizationFixture;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class OrganizationRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<PartyLink> LINK_MAPPER = (rs, rowNum) -> new PartyLink(
        rs.getLong("id"),
        JdbcInserts.nullableLong(rs, "party_id")
    );

    public OrganizationRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<PartyLink> findByName(long tenantId, String name) {
        List<PartyLink> results = jdbc.query(
            "SELECT id, party_id FROM organization WHERE tenant_id = ? AND name = ?",
            LINK_MAPPER, tenantId, name
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Long> findPartyId(long organizationId) {
        List<Long> results = jdbc.queryForList(
            "SELECT party_id FROM organization WHERE id = ?", Long.class, organizationId);
        return results.isEmpty() ? Optional.empty() : Optional.ofNullable(results.get(0));
    }

    public long save(long tenantId, long partyId, String name, String email, String programSlug,
                     OrganizationFixture org) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO organization (tenant_id, party_id, name, email, phone, website, city, state,
                                      country, program_slug, public_program, program_bio)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, partyId, name, email, org.phone(), org.website(), org.city(), org.state(),
            org.country(), programSlug, org.publicProgram(), org.programBio()
        );
    }
}
