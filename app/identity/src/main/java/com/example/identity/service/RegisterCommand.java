package com.example.identity.service;

import com.example.identity.model.AccountProfile;

/** Either {@code password} or the {@code provider}/{@code providerId} pair must be present. */
public record RegisterCommand(
    String email,
    String username,
    String password,
    String provider,
    String providerId,
    AccountProfile profile) {

  public boolean hasExternalIdentity() {
    return provider != null && !provider.isBlank() && providerId != null && !providerId.isBlank();
  }

  @Override
  public String toString() {
    return "RegisterCommand[email=" + email + ", username=" + username + ", provider=" + provider
        + "]";
  }
}
