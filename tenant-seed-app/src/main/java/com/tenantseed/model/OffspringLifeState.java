package com.tenantseed.model;

public enum OffspringLifeState {
    ALIVE,
    DECEASED
}
