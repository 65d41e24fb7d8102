package com.example.identity.service;

public class IdentityException extends RuntimeException {

  private final ErrorKind kind;

  public IdentityException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public IdentityException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  public static IdentityException validation(String message) {
    return new IdentityException(ErrorKind.VALIDATION, message);
  }

  public static IdentityException conflict(String message) {
    return new IdentityException(ErrorKind.CONFLICT, message);
  }

  public static IdentityException invalidCredentials() {
    return new IdentityException(ErrorKind.INVALID_CREDENTIALS, "invalid email or password");
  }

  public static IdentityException accountInactive(String message) {
    return new IdentityException(ErrorKind.ACCOUNT_INACTIVE, message);
  }

  public static IdentityException notFound(String message) {
    return new IdentityException(ErrorKind.NOT_FOUND, message);
  }

  public static IdentityException tokenExpired(String message) {
    return new IdentityException(ErrorKind.TOKEN_EXPIRED, message);
  }

  public static IdentityException tokenInvalid(String message) {
    return new IdentityException(ErrorKind.TOKEN_INVALID, message);
  }

  public static IdentityException noPasswordSet() {
    return new IdentityException(
        ErrorKind.NO_PASSWORD_SET, "account has no password; sign in with the external provider");
  }

  public static IdentityException illegalTransition(String message) {
    return new IdentityException(ErrorKind.ILLEGAL_TRANSITION, message);
  }
}
