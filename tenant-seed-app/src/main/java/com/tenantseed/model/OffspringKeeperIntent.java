package com.tenantseed.model;

public enum OffspringKeeperIntent {
    AVAILABLE,
    UNDER_EVALUATION,
    WITHHELD,
    KEEP
}
