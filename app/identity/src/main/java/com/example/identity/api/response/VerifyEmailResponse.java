package com.example.identity.api.response;

public record VerifyEmailResponse(boolean verified, String status) {
}
