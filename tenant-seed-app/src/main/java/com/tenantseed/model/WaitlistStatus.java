package com.tenantseed.model;

/**
 * Waitlist progression. Every status past INQUIRY has been approved; DEPOSIT_PAID and
 * ALLOCATED have also paid their deposit.
 */
public enum WaitlistStatus {
    INQUIRY,
    APPROVED,
    DEPOSIT_PAID,
    ALLOCATED;

    public boolean isApproved() {
        return this != INQUIRY;
    }

    public boolean isDepositPaid() {
        return this == DEPOSIT_PAID || this == ALLOCATED;
    }
}
