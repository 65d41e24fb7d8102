/*
 * どこで: app/identity/src/main/java/com/example/identity/api/response/AuthResponse.java
 * 何を: ログイン/リフレッシュ成功時の出力 DTO
 */
package com.example.identity.api.response;

import com.example.identity.service.AuthResult;

public record AuthResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresInSeconds) {

    public static AuthResponse from(AuthResult result) {
        return new AuthResponse(
                result.accessToken(),
                result.refreshToken(),
                result.tokenType(),
                result.expiresInSeconds());
    }
}
