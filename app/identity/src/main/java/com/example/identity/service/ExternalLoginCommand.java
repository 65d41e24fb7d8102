package com.example.identity.service;

import com.example.identity.model.AccountProfile;

/**
 * Sign-in asserted by a trusted external identity provider.
 *
 * @param username preferred username for a first sighting; derived from the email when absent
 */
public record ExternalLoginCommand(
    String provider,
    String providerId,
    String email,
    String username,
    AccountProfile profile,
    String originAddress) {}
