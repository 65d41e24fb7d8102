/*
 * どこで: app/identity/src/main/java/com/example/identity/model/LifecycleEvent.java
 * 何を: 管理操作による状態遷移イベント
 */
package com.example.identity.model;

public enum LifecycleEvent {
    ACTIVATE,
    DEACTIVATE,
    SUSPEND,
    SOFT_DELETE
}
