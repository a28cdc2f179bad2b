package com.tenantseed.model;

public enum ListingStatus {
    DRAFT,
    ACTIVE,
    PAUSED
}
