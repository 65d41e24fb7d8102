/*
 * どこで: app/identity/src/main/java/com/example/identity/model/AccountRole.java
 * 何を: アカウントのロールを表す列挙型
 * なぜ: 状態とは独立した権限軸として RBAC 判定に使うため
 */
package com.example.identity.model;

public enum AccountRole {
    USER,
    MODERATOR,
    ADMIN
}
