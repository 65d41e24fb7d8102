package com.example.identity.repository;

/** 読み込み後に別リクエストが同じアカウント行を更新した。 */
public class StaleAccountException extends RuntimeException {

  private final String accountId;

  public StaleAccountException(String accountId) {
    super("account was modified concurrently: " + accountId);
    this.accountId = accountId;
  }

  public String accountId() {
    return accountId;
  }
}
