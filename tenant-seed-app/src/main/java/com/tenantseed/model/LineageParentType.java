package com.tenantseed.model;

public enum LineageParentType {
    SIRE,
    DAM
}
