package com.tenantseed.model;

public enum TagTargetKind {
    PARTY,
    ANIMAL,
    BREEDING_PLAN,
    WAITLIST_ENTRY,
    OFFSPRING_GROUP,
    OFFSPRING
}
