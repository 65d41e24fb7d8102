/*
 * どこで: app/identity/src/main/java/com/example/identity/model/SingleUseTokenPurpose.java
 * 何を: 単回利用トークンの用途
 * なぜ: 用途ごとに別スロットへ保存し、用途違いの消費を無効扱いにするため
 */
package com.example.identity.model;

public enum SingleUseTokenPurpose {
    EMAIL_VERIFICATION,
    PASSWORD_RESET
}
