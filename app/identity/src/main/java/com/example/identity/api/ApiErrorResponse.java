/*
 * どこで: app/identity/src/main/java/com/example/identity/api/ApiErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: code に ErrorKind 名を入れ、呼び出し側がメッセージ文字列で分岐しないようにするため
 */
package com.example.identity.api;

public record ApiErrorResponse(
        String code,
        String message,
        boolean retryable) {
}
