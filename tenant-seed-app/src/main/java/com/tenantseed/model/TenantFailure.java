package com.tenantseed.model;

public record TenantFailure(String tenantSlug, String message) {
}
