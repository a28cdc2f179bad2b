package com.tenantseed.model.fixture;

import com.tenantseed.model.WaitlistStatus;

/**
 * Commercial history of one contact: an optional waitlist spot on a breeding plan, an
 * optional paid deposit and lifetime purchases.
 */
public record ContactMetaFixture(
    int contactIndex,
    String leadStatus,
    Integer waitlistPlanIndex,
    Integer waitlistPosition,
    WaitlistStatus waitlistStatus,
    Integer depositAmountCents,
    boolean hasActiveDeposit,
    int totalPurchasesCents,
    int animalsOwned
) {
    public boolean wantsWaitlistEntry() {
        return waitlistPlanIndex != null && waitlistPosition != null;
    }

    public WaitlistStatus effectiveWaitlistStatus() {
        return waitlistStatus == null ? WaitlistStatus.INQUIRY : waitlistStatus;
    }
}
