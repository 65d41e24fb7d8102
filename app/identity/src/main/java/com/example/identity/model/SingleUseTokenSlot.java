/*
 * どこで: app/identity/src/main/java/com/example/identity/model/SingleUseTokenSlot.java
 * 何を: アカウント上に保存する単回利用トークンのダイジェストと期限
 * なぜ: 平文トークンを永続化せず、照合はダイジェストで行うため
 */
package com.example.identity.model;

import java.time.Instant;

public record SingleUseTokenSlot(String digest, Instant expiresAt) {

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }
}
