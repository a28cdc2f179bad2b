package com.tenantseed.model.fixture;

import java.time.LocalDate;

public record AnimalTitleFixture(
    String titleAbbreviation,
    LocalDate dateEarned,
    String eventName,
    String eventLocation,
    String handlerName,
    Integer pointsEarned,
    Integer majorWins
) {
}
