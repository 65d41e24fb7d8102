/*
 * どこで: app/identity/src/main/java/com/example/identity/model/AccountRecord.java
 * 何を: accounts テーブル相当の集約ルート
 * なぜ: Service/Repository 間で不変のスナップショットとして受け渡し、変更は AccountLifecycle 経由に限定するため
 */
package com.example.identity.model;

import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record AccountRecord(
        String id,
        String email,
        String username,
        String passwordHash,
        ExternalIdentity externalIdentity,
        boolean emailVerified,
        SingleUseTokenSlot verificationToken,
        SingleUseTokenSlot passwordResetToken,
        AccountProfile profile,
        AccountRole role,
        AccountStatus status,
        boolean active,
        Instant lastLoginAt,
        String lastLoginAddress,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt,
        long version) {

    public AccountRecord {
        profile = profile == null ? AccountProfile.empty() : profile;
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isBlank();
    }

    public boolean isDeleted() {
        return status == AccountStatus.DELETED;
    }

    /** version 0 は未保存を表す。 */
    public boolean isNew() {
        return version == 0L;
    }

    public SingleUseTokenSlot tokenFor(SingleUseTokenPurpose purpose) {
        return switch (purpose) {
            case EMAIL_VERIFICATION -> verificationToken;
            case PASSWORD_RESET -> passwordResetToken;
        };
    }
}
