package com.tenantseed.model.fixture;

public record ContactFixture(
    String firstName,
    String lastName,
    String nickname,
    String email,
    String phone,
    String city,
    String state,
    String country
) {
    public String displayName() {
        if (nickname != null && !nickname.isBlank()) {
            return firstName + " \"" + nickname + "\" " + lastName;
        }
        return firstName + " " + lastName;
    }
}
