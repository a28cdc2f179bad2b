package com.tenantseed.model;

public enum OffspringFinancialState {
    NONE,
    DEPOSIT_PENDING,
    DEPOSIT_PAID,
    PAID_IN_FULL,
    REFUNDED,
    CHARGEBACK
}
