package com.tenantseed.model.fixture;

public record TitleDefinitionFixture(
    String species,
    String abbreviation,
    String fullName,
    String category,
    String organization,
    boolean prefix,
    Integer pointsRequired,
    String prerequisiteTitle
) {
}
