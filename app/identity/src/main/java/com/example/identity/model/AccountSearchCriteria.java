package com.example.identity.model;

public record AccountSearchCriteria(
    String searchTerm,
    AccountRole role,
    AccountStatus status,
    String provider,
    Boolean emailVerified,
    Boolean active,
    int offset,
    int limit) {

  public static final int MAX_LIMIT = 200;

  public AccountSearchCriteria {
    offset = Math.max(offset, 0);
    limit = limit <= 0 ? 100 : Math.min(limit, MAX_LIMIT);
    searchTerm = searchTerm == null || searchTerm.isBlank() ? null : searchTerm.trim();
    provider = provider == null || provider.isBlank() ? null : provider.trim();
  }
}
