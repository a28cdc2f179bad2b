package com.tenantseed.repository;

import com.tenantseed.model.fixture.ListingFixture;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.tenantseed.repository.JdbcInserts.timestamp;

@Repository
public class ListingRepository {

    private final JdbcTemplate jdbc;

    public ListingRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Long> findIdByTitle(long tenantId, String title) {
        List<Long> results = jdbc.queryForList(
            "SELECT id FROM marketplace_listing WHERE tenant_id = ? AND title = ?",
            Long.class, tenantId, title
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long save(long tenantId, String title, ListingFixture listing, Instant publishedAt) {
        return JdbcInserts.insert(jdbc, """
            INSERT INTO marketplace_listing (tenant_id, title, description, listing_type, status,
                                             price_cents, price_type, city, state, country, published_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            tenantId, title, listing.description(), listing.listingType().name(), listing.status().name(),
            listing.priceCents(), listing.priceType(), listing.city(), listing.state(), listing.country(),
            timestamp(publishedAt)
        );
    }
}
