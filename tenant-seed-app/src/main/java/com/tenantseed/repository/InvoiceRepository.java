package com.tenantseed.repository;

import com.tenantseed.model.InvoiceCategory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

@Repository
public class InvoiceRepository {

    private final JdbcTemplate jdbc;

    public InvoiceRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findPaidId(long tenantId, long clientPartyId, InvoiceCategory category) {
        List<Long> results = jdbc.queryForList("""
            SELECT id FROM invoice
            WHERE tenant_id = ? AND client_party_id = ? AND category = ? AND status = 'paid'
            """,
            Long.class, tenantId, clientPartyId, category.name()
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Inserts a fully paid invoice.
     */
    public long savePaid(long tenantId, long clientPartyId, InvoiceCategory category, String invoiceNumber,
                         String referenceNumber, String scope, int amountCents, Integer depositCents,
                         Instant issuedAt, Instant dueAt, Instant paidAt, String notes) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO invoice (tenant_id, client_party_id, invoice_number, reference_number, status,
                category, scope, amount_cents, balance_cents, deposit_cents, issued_at, due_at, paid_at, notes)
            VALUES (?, ?, ?, ?, 'paid', ?, ?, ?, 0, ?, ?, ?, ?, ?)
            """,
            tenantId, clientPartyId, invoiceNumber, referenceNumber, category.name(), scope, amountCents,
            depositCents, timestamp(issuedAt), timestamp(dueAt), timestamp(paidAt), notes
        );
    }
}
