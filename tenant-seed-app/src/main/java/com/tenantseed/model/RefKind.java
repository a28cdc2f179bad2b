package com.tenantseed.model;

/**
 * Kinds of record a fixture can point at by handle.
 */
public enum RefKind {
    /** Party id of an organization, keyed by qualified organization name. */
    ORGANIZATION_PARTY(false),
    /** Party id of a contact, keyed by qualified contact email. */
    CONTACT_PARTY(false),
    /** Animal id, keyed by qualified name and scoped by species. */
    ANIMAL(false),
    /** Breeding plan id, keyed by qualified plan name. */
    BREEDING_PLAN(false),
    /** Marketplace shopper user id, keyed by qualified email. */
    MARKETPLACE_USER(true),
    /** Title definition id, keyed by abbreviation and scoped by species. */
    TITLE_DEFINITION(true);

    private final boolean global;

    RefKind(boolean global) {
        this.global = global;
    }

    /** Global kinds are shared by all tenants; the tenant id is ignored when resolving them. */
    public boolean isGlobal() {
        return global;
    }
}
