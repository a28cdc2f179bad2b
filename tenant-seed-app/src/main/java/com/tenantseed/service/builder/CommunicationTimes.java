package com.tenantseed.service.builder;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixture communications are timed relative to the run, never with absolute dates.
 */
final class CommunicationTimes {

    private CommunicationTimes() {
    }

    static Instant ago(Instant now, int days, int hours) {
        return now.minus(Duration.ofDays(days)).minus(Duration.ofHours(hours));
    }
}
