package com.tenantseed.model;

public record UpsertResult(long id, boolean created) {
}
