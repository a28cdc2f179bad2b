package com.tenantseed.model;

import com.tenantseed.model.fixture.OffspringGroupFixture;

import java.util.List;

/**
 * An offspring group after seeding. {@code offspringIds} follows the order of the fixture's
 * offspring list.
 */
public record SeededLitter(long groupId, OffspringGroupFixture fixture, List<Long> offspringIds) {

    public SeededLitter {
        offspringIds = List.copyOf(offspringIds);
    }
}
