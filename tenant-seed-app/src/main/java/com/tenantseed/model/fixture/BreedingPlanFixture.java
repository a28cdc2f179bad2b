package com.tenantseed.model.fixture;

import com.tenantseed.model.PlanStatus;

import java.time.LocalDate;

public record BreedingPlanFixture(
    String name,
    String nickname,
    String species,
    String breedText,
    String damRef,
    String sireRef,
    PlanStatus status,
    String notes,
    LocalDate expectedCycleStart
) {
}
