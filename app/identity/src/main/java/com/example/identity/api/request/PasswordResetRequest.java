package com.example.identity.api.request;

public record PasswordResetRequest(String email) {
}
