package com.example.identity.service;

public record AuthResult(
    String accountId,
    String accessToken,
    String refreshToken,
    String tokenType,
    long expiresInSeconds) {

  public static final String BEARER = "bearer";

  @Override
  public String toString() {
    return "AuthResult[accountId=" + accountId + ", expiresInSeconds=" + expiresInSeconds + "]";
  }
}
