package com.tenantseed.model;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}
