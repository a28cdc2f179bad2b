package com.tenantseed.model.fixture;

import com.tenantseed.model.DraftChannel;

public record DraftFixture(
    Integer contactIndex,
    DraftChannel channel,
    String subject,
    String body,
    int daysAgo
) {
}
