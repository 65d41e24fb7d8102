/*
 * どこで: app/identity/src/main/java/com/example/identity/model/AuditLogRecord.java
 * 何を: audit_logs テーブル相当のドメインレコード
 * なぜ: 管理操作(停止/削除/ロール変更)の追跡可能性を担保するため
 */
package com.example.identity.model;

import java.time.Instant;

public record AuditLogRecord(
        String id,
        String actorAccountId,
        String action,
        String targetAccountId,
        String metadataJson,
        Instant createdAt) {
}
