package com.tenantseed.model.fixture;

import com.tenantseed.model.MessageDirection;

/**
 * One message in a thread, timed relative to the run: {@code daysAgo} days plus
 * {@code hoursAgo} hours before now.
 */
public record MessageFixture(
    MessageDirection direction,
    String body,
    int daysAgo,
    int hoursAgo
) {
}
