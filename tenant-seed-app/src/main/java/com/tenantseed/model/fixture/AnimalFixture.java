package com.tenantseed.model.fixture;

import java.util.List;
import java.util.Map;

/**
 * One animal in a tenant's catalogue. {@code generation} is 0 for founders; a parent always
 * carries a strictly lower generation than its offspring. Parents are referenced by base name
 * within the same species.
 */
public record AnimalFixture(
    String name,
    String species,
    String sex,
    String breed,
    int generation,
    String sireRef,
    String damRef,
    int birthYear,
    String notes,
    GeneticsFixture genetics,
    String testProvider,
    List<AnimalTitleFixture> titles,
    List<CompetitionFixture> competitions,
    Map<String, Boolean> privacyOverrides
) {
    public AnimalFixture {
        genetics = genetics == null ? GeneticsFixture.empty() : genetics;
        titles = titles == null ? List.of() : List.copyOf(titles);
        competitions = competitions == null ? List.of() : List.copyOf(competitions);
        privacyOverrides = privacyOverrides == null ? Map.of() : Map.copyOf(privacyOverrides);
    }
}
