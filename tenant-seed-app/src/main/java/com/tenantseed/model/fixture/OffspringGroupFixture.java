package com.tenantseed.model.fixture;

import java.time.LocalDate;
import java.util.List;

/**
 * A litter born to a dam and sire of the same tenant, with its head counts and offspring.
 * Parents are referenced by base name within the group's species.
 */
public record OffspringGroupFixture(
    String name,
    String species,
    String damRef,
    String sireRef,
    LocalDate actualBirthOn,
    Integer countBorn,
    Integer countLive,
    Integer countStillborn,
    Integer countMale,
    Integer countFemale,
    Integer countWeaned,
    Integer countPlaced,
    LocalDate weanedAt,
    LocalDate placementCompletedAt,
    String notes,
    List<OffspringFixture> offspring
) {
    public OffspringGroupFixture {
        offspring = offspring == null ? List.of() : List.copyOf(offspring);
    }
}
