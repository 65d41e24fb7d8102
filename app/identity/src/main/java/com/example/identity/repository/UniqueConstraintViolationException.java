/*
 * どこで: app/identity/src/main/java/com/example/identity/repository/UniqueConstraintViolationException.java
 * 何を: 一意制約違反をどの制約かと共に表す例外
 * なぜ: externalLogin の競合(作成→再取得)と登録の Conflict を呼び出し側で分岐できるようにするため
 */
package com.example.identity.repository;

public class UniqueConstraintViolationException extends RuntimeException {

  public enum Constraint {
    EMAIL,
    USERNAME,
    EXTERNAL_IDENTITY,
    SINGLE_USE_TOKEN,
    ACCOUNT_ID
  }

  private final Constraint constraint;

  public UniqueConstraintViolationException(Constraint constraint, Throwable cause) {
    super("unique constraint violated: " + constraint, cause);
    this.constraint = constraint;
  }

  public Constraint constraint() {
    return constraint;
  }
}
