package com.tenantseed.model;

public enum PortalAccessStatus {
    INVITED,
    ACTIVE
}
