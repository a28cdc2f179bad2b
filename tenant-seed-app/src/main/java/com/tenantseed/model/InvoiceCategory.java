package com.tenantseed.model;

public enum InvoiceCategory {
    DEPOSIT,
    GOODS
}
