package com.example.identity.api.response;

import com.example.identity.service.RegistrationResult;

public record RegistrationResponse(String accountId, String email, String username, String status) {

    public static RegistrationResponse from(RegistrationResult result) {
        return new RegistrationResponse(
                result.accountId(), result.email(), result.username(), result.status().name());
    }
}
