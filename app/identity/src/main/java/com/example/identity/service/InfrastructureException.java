package com.example.identity.service;

/** ストア/ワーカープール起因の失敗。ドメインエラーと区別し、呼び出し側のみが再試行を判断する。 */
public class InfrastructureException extends IdentityException {

  public enum Reason {
    TIMEOUT,
    UNAVAILABLE,
    REJECTED,
    CANCELLED
  }

  private final Reason reason;

  public InfrastructureException(Reason reason, String message) {
    super(ErrorKind.INFRASTRUCTURE, message);
    this.reason = reason;
  }

  public InfrastructureException(Reason reason, String message, Throwable cause) {
    super(ErrorKind.INFRASTRUCTURE, message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
