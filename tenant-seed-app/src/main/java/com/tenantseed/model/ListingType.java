package com.tenantseed.model;

public enum ListingType {
    BREEDING_PROGRAM,
    STUD_SERVICE
}
