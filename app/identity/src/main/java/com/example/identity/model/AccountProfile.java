/*
 * どこで: app/identity/src/main/java/com/example/identity/model/AccountProfile.java
 * 何を: 表示用プロフィール項目
 */
package com.example.identity.model;

public record AccountProfile(
        String firstName,
        String lastName,
        String nickname,
        String phone,
        String avatarUrl,
        String bio) {

    public static AccountProfile empty() {
        return new AccountProfile(null, null, null, null, null, null);
    }

    /** null の項目は現在値を維持する。 */
    public AccountProfile merge(AccountProfile patch) {
        if (patch == null) {
            return this;
        }
        return new AccountProfile(
                patch.firstName() != null ? patch.firstName() : firstName,
                patch.lastName() != null ? patch.lastName() : lastName,
                patch.nickname() != null ? patch.nickname() : nickname,
                patch.phone() != null ? patch.phone() : phone,
                patch.avatarUrl() != null ? patch.avatarUrl() : avatarUrl,
                patch.bio() != null ? patch.bio() : bio);
    }
}
