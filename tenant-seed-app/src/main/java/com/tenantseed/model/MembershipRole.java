package com.tenantseed.model;

public enum MembershipRole {
    OWNER,
    STAFF,
    CLIENT,
    VIEWER
}
