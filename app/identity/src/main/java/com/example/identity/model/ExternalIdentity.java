/*
 * どこで: app/identity/src/main/java/com/example/identity/model/ExternalIdentity.java
 * 何を: 外部 IdP が払い出した provider + providerId の組
 */
package com.example.identity.model;

public record ExternalIdentity(String provider, String providerId) {

  public ExternalIdentity {
    if (provider == null || provider.isBlank()) {
      throw new IllegalArgumentException("provider is required");
    }
    if (providerId == null || providerId.isBlank()) {
      throw new IllegalArgumentException("providerId is required");
    }
  }
}
