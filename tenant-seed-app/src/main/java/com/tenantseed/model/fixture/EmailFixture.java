package com.tenantseed.model.fixture;

import com.tenantseed.model.MessageDirection;

public record EmailFixture(
    int contactIndex,
    String subject,
    String body,
    MessageDirection direction,
    String status,
    boolean read,
    int daysAgo
) {
}
