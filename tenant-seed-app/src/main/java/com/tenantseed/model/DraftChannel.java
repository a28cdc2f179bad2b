package com.tenantseed.model;

public enum DraftChannel {
    EMAIL,
    DM
}
