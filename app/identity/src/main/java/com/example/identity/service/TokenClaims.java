package com.example.identity.service;

import com.example.identity.model.AccountRole;
import java.time.Instant;

/** 検証済み署名トークンのクレーム。role は access トークンのみ。 */
public record TokenClaims(
    String subject,
    TokenType type,
    AccountRole role,
    Instant issuedAt,
    Instant expiresAt,
    String tokenId,
    String issuer) {}
