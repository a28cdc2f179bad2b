package com.tenantseed.model;

public enum OffspringPaperworkState {
    NONE,
    SENT,
    SIGNED,
    COMPLETE
}
