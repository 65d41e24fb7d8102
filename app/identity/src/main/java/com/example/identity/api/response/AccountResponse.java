/*
 * どこで: app/identity/src/main/java/com/example/identity/api/response/AccountResponse.java
 * 何を: アカウント参照系 API の出力 DTO
 * なぜ: パスワードダイジェストや単回トークンを応答へ含めない形に固定するため
 */
package com.example.identity.api.response;

import com.example.identity.model.AccountRecord;
import java.time.Instant;

public record AccountResponse(
        String accountId,
        String email,
        String username,
        boolean emailVerified,
        String role,
        String status,
        boolean active,
        String provider,
        boolean hasPassword,
        String firstName,
        String lastName,
        String nickname,
        String phone,
        String avatarUrl,
        String bio,
        Instant lastLoginAt,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt) {

    public static AccountResponse from(AccountRecord account) {
        return new AccountResponse(
                account.id(),
                account.email(),
                account.username(),
                account.emailVerified(),
                account.role().name(),
                account.status().name(),
                account.active(),
                account.externalIdentity() == null ? null : account.externalIdentity().provider(),
                account.hasPassword(),
                account.profile().firstName(),
                account.profile().lastName(),
                account.profile().nickname(),
                account.profile().phone(),
                account.profile().avatarUrl(),
                account.profile().bio(),
                account.lastLoginAt(),
                account.createdAt(),
                account.updatedAt(),
                account.deletedAt());
    }
}
