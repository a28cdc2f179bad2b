package com.tenantseed.model.fixture;

public record UserFixture(
    String firstName,
    String lastName,
    String email,      // base address, qualified per environment
    String password,
    boolean superAdmin
) {
    public String fullName() {
        return firstName + " " + lastName;
    }
}
