package com.example.identity.model;

public record AccountStatistics(
    long total,
    long pending,
    long active,
    long inactive,
    long suspended,
    long deleted,
    long admins,
    long verified,
    long unverified) {}
