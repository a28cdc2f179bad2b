package com.tenantseed.repository;

import com.tenantseed.model.PartyLink;
import com.tenantseed.model.fixture.ContactFixture;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ContactRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<PartyLink> LINK_MAPPER = (rs, rowNum) -> new PartyLink(
        rs.getLong("id"),
        JdbcInserts.nullableLong(rs, "party_id")
    );

    public ContactRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<PartyLink> findByEmail(long tenantId, String email) {
        List<PartyLink> results = jdbc.query(
            "SELECT id, party_id FROM contact WHERE tenant_id = ? AND email = ?",
            LINK_MAPPER, tenantId, email
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<PartyLink> findById(long contactId) {
        List<PartyLink> results = jdbc.query(
            "SELECT id, party_id FROM contact WHERE id = ?", LINK_MAPPER, contactId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long tenantId, Long partyId, String email, ContactFixture contact) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO contact (tenant_id, party_id, first_name, last_name, display_name, nickname,
                                 email, phone, city, state, country)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, partyId, contact.firstName(), contact.lastName(), contact.displayName(),
            contact.nickname(), email, contact.phone(), contact.city(), contact.state(), contact.country()
        );
    }

    public void linkParty(long contactId, long partyId) {
        jdbc.update("UPDATE contact SET party_id = ? WHERE id = ?", partyId, contactId);
    }
}
