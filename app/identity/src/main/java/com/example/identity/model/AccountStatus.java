/*
 * どこで: app/identity/src/main/java/com/example/identity/model/AccountStatus.java
 * 何を: アカウントのライフサイクル状態を表す列挙型
 * なぜ: 遷移可否の判定を AccountLifecycle に集約するため
 */
package com.example.identity.model;

public enum AccountStatus {
    PENDING,
    ACTIVE,
    INACTIVE,
    SUSPENDED,
    DELETED;

    public boolean isTerminal() {
        return this == DELETED;
    }
}
