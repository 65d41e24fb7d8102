package com.example.identity.api.response;

import com.example.identity.service.ExternalLoginResult;

public record ExternalLoginResponse(
        String accountId,
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresInSeconds,
        boolean newAccount) {

    public static ExternalLoginResponse from(ExternalLoginResult result) {
        return new ExternalLoginResponse(
                result.auth().accountId(),
                result.auth().accessToken(),
                result.auth().refreshToken(),
                result.auth().tokenType(),
                result.auth().expiresInSeconds(),
                result.newAccount());
    }
}
