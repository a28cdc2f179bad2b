package com.tenantseed.model.fixture;

import java.util.List;

/**
 * A direct-message thread with either a marketplace shopper or a tenant contact. Exactly one
 * of {@code marketplaceUserIndex} and {@code contactIndex} is expected.
 */
public record ThreadFixture(
    Integer marketplaceUserIndex,
    Integer contactIndex,
    String subject,
    String inquiryType,
    boolean flagged,
    boolean archived,
    List<MessageFixture> messages
) {
    public ThreadFixture {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
