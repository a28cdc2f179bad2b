package com.tenantseed.service.builder;

import com.tenantseed.model.EntityKind;
import com.tenantseed.model.ListingStatus;
import com.tenantseed.model.Lookup;
import com.tenantseed.model.TenantScope;
import com.tenantseed.model.fixture.ListingFixture;
import com.tenantseed.repository.ListingRepository;
import com.tenantseed.service.SeedContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Component
public class ListingBuilder {

    private final ListingRepository listings;
    private final Clock clock;

    public ListingBuilder(ListingRepository listings, Clock clock) {
        this.listings = listings;
        this.clock = clock;
    }

    public void build(SeedContext ctx, TenantScope scope, List<ListingFixture> fixtures) {
        long tenantId = scope.tenantId();
        for (ListingFixture listing : fixtures) {
            String title = scope.name(listing.title());
            Instant publishedAt = listing.status() == ListingStatus.ACTIVE ? clock.instant() : null;
            ctx.upsert().upsert(EntityKind.MARKETPLACE_LISTING, tenantId, title, listing,
                () -> Lookup.of(listings.findIdByTitle(tenantId, title)),
                () -> listings.save(tenantId, title, listing, publishedAt));
        }
    }
}
