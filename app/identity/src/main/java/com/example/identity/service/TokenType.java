package com.example.identity.service;

public enum TokenType {
  ACCESS("access"),
  REFRESH("refresh");

  private final String claimValue;

  TokenType(String claimValue) {
    this.claimValue = claimValue;
  }

  public String claimValue() {
    return claimValue;
  }

  public static TokenType fromClaim(String value) {
    for (TokenType type : values()) {
      if (type.claimValue.equals(value)) {
        return type;
      }
    }
    throw IdentityException.tokenInvalid("unknown token type");
  }
}
