/*
 * どこで: app/identity/src/main/java/com/example/identity/api/request/ExternalLoginRequest.java
 * 何を: POST /auth/external-login の入力 DTO
 * なぜ: ゲートウェイが検証済みの IdP 主張だけを受け取るため
 */
package com.example.identity.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ExternalLoginRequest(
        @NotBlank @Size(max = 50) String provider,
        @NotBlank @Size(max = 255) String providerId,
        @NotBlank @Email @Size(max = 255) String email,
        @Size(max = 50) String username,
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        @Size(max = 100) String nickname,
        @Size(max = 500) String avatarUrl) {
}
