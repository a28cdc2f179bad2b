package com.tenantseed.model.fixture;

import com.tenantseed.model.ListingStatus;
import com.tenantseed.model.ListingType;

public record ListingFixture(
    String title,
    String description,
    ListingType listingType,
    ListingStatus status,
    Integer priceCents,
    String priceType,
    String city,
    String state,
    String country
) {
}
