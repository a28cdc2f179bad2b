package com.tenantseed.model;

public enum PartyType {
    CONTACT,
    ORGANIZATION
}
