package com.tenantseed.model.fixture;

import java.time.LocalDate;

public record CompetitionFixture(
    String eventName,
    LocalDate eventDate,
    String location,
    String organization,
    String competitionType,
    String className,
    Integer placement,
    String placementLabel,
    Integer pointsEarned,
    boolean majorWin,
    String judgeName
) {
}
