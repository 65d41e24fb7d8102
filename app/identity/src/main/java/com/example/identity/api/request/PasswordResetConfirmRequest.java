package com.example.identity.api.request;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetConfirmRequest(@NotBlank String token, @NotBlank String newPassword) {

    @Override
    public String toString() {
        return "PasswordResetConfirmRequest[]";
    }
}
