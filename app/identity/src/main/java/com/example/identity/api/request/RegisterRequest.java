/*
 * どこで: app/identity/src/main/java/com/example/identity/api/request/RegisterRequest.java
 * 何を: POST /auth/register の入力 DTO
 * なぜ: パスワード登録に必要な項目を限定し、形式検査を境界で済ませるため
 */
package com.example.identity.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Email @Size(max = 255) String email,
        @NotBlank @Size(min = 3, max = 50) String username,
        @NotBlank @Size(min = 8) String password,
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        @Size(max = 100) String nickname) {

    @Override
    public String toString() {
        return "RegisterRequest[email=" + email + ", username=" + username + "]";
    }
}
