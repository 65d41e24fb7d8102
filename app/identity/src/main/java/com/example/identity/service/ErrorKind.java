/*
 * どこで: app/identity/src/main/java/com/example/identity/service/ErrorKind.java
 * 何を: Identity コアが返す失敗種別
 * なぜ: 呼び出し側がメッセージ文字列に依存せず、再試行可否を判定できるようにするため
 */
package com.example.identity.service;

public enum ErrorKind {
    VALIDATION,
    CONFLICT,
    INVALID_CREDENTIALS,
    ACCOUNT_INACTIVE,
    NOT_FOUND,
    TOKEN_EXPIRED,
    TOKEN_INVALID,
    NO_PASSWORD_SET,
    ILLEGAL_TRANSITION,
    INFRASTRUCTURE;

    public boolean isRetryable() {
        return this == INFRASTRUCTURE;
    }
}
