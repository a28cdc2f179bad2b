package com.tenantseed.model.fixture;

import java.util.List;

public record GeneticsFixture(
    List<LocusFixture> coatColor,
    List<LocusFixture> coatType,
    List<LocusFixture> physicalTraits,
    List<LocusFixture> eyeColor,
    List<LocusFixture> health
) {
    public GeneticsFixture {
        coatColor = coatColor == null ? List.of() : List.copyOf(coatColor);
        coatType = coatType == null ? List.of() : List.copyOf(coatType);
        physicalTraits = physicalTraits == null ? List.of() : List.copyOf(physicalTraits);
        eyeColor = eyeColor == null ? List.of() : List.copyOf(eyeColor);
        health = health == null ? List.of() : List.copyOf(health);
    }

    public static GeneticsFixture empty() {
        return new GeneticsFixture(null, null, null, null, null);
    }
}
