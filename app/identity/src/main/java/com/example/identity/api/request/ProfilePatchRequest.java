/*
 * どこで: app/identity/src/main/java/com/example/identity/api/request/ProfilePatchRequest.java
 * 何を: PATCH /me の入力 DTO
 * なぜ: 本人が変更可能な項目を限定するため。null の項目は変更しない
 */
package com.example.identity.api.request;

import com.example.identity.model.AccountProfile;
import com.example.identity.service.ProfileUpdate;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record ProfilePatchRequest(
        @Email @Size(max = 255) String email,
        @Size(min = 3, max = 50) String username,
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        @Size(max = 100) String nickname,
        @Size(max = 20) String phone,
        @Size(max = 500) String avatarUrl,
        @Size(max = 2000) String bio) {

    public ProfileUpdate toProfileUpdate() {
        return new ProfileUpdate(
                email,
                username,
                new AccountProfile(firstName, lastName, nickname, phone, avatarUrl, bio));
    }
}
