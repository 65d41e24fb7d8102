package com.example.identity.service;

public record ExternalLoginResult(AuthResult auth, boolean newAccount) {}
