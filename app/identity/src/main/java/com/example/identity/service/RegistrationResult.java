package com.example.identity.service;

import com.example.identity.model.AccountStatus;

public record RegistrationResult(
    String accountId, String email, String username, AccountStatus status) {}
