package com.tenantseed.model;

public enum PlanStatus {
    PLANNING,
    COMMITTED
}
