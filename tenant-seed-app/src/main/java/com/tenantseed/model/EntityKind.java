package com.tenantseed.model;

/**
 * Every record kind the seeder creates. The label is used in console narration and in the
 * final tally.
 */
public enum EntityKind {

    TENANT("Tenant"),
    TENANT_SETTING("Tenant setting"),
    USER("User"),
    MEMBERSHIP("Membership"),
    PARTY("Party"),
    ORGANIZATION("Organization"),
    CONTACT("Contact"),
    ANIMAL("Animal"),
    TITLE_DEFINITION("Title definition"),
    ANIMAL_TITLE("Animal title"),
    COMPETITION_ENTRY("Competition entry"),
    BREEDING_PLAN("Breeding plan"),
    OFFSPRING_GROUP("Offspring group"),
    OFFSPRING("Offspring"),
    MARKETPLACE_LISTING("Marketplace listing"),
    TAG("Tag"),
    TAG_ASSIGNMENT("Tag assignment"),
    PORTAL_ACCESS("Portal access"),
    WAITLIST_ENTRY("Waitlist entry"),
    INVOICE("Invoice"),
    EMAIL("Email"),
    MESSAGE_THREAD("Message thread"),
    MESSAGE("Message"),
    DRAFT("Draft"),
    CROSS_TENANT_LINK("Cross-tenant link");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
