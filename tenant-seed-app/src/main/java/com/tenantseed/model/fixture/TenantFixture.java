package com.tenantseed.model.fixture;

import java.util.List;

/**
 * Everything seeded for one tenant. List order is significant: index handles, tag rules and
 * portal access all pick entries by position.
 */
public record TenantFixture(
    String slug,
    ThemeFixture theme,
    MarketplaceVisibility marketplaceVisibility,
    VisibilityPolicy lineageVisibility,
    List<String> species,
    UserFixture owner,
    List<OrganizationFixture> organizations,
    List<ContactFixture> contacts,
    List<AnimalFixture> animals,
    List<BreedingPlanFixture> breedingPlans,
    List<ListingFixture> listings,
    PortalAccessFixture portalAccess,
    List<ContactMetaFixture> contactMeta,
    List<EmailFixture> emails,
    List<ThreadFixture> threads,
    List<DraftFixture> drafts,
    List<OffspringGroupFixture> offspringGroups
) {
    public TenantFixture {
        species = species == null ? List.of() : List.copyOf(species);
        organizations = organizations == null ? List.of() : List.copyOf(organizations);
        contacts = contacts == null ? List.of() : List.copyOf(contacts);
        animals = animals == null ? List.of() : List.copyOf(animals);
        breedingPlans = breedingPlans == null ? List.of() : List.copyOf(breedingPlans);
        listings = listings == null ? List.of() : List.copyOf(listings);
        contactMeta = contactMeta == null ? List.of() : List.copyOf(contactMeta);
        emails = emails == null ? List.of() : List.copyOf(emails);
        threads = threads == null ? List.of() : List.copyOf(threads);
        drafts = drafts == null ? List.of() : List.copyOf(drafts);
        offspringGroups = offspringGroups == null ? List.of() : List.copyOf(offspringGroups);
    }
}
