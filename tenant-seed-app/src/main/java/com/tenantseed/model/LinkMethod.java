package com.tenantseed.model;

/**
 * How a breeder connected their animal to a parent owned by another tenant.
 */
public enum LinkMethod {
    SEARCH,
    EXCHANGE_CODE,
    MANUAL
}
