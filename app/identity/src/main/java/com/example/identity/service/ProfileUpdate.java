package com.example.identity.service;

import com.example.identity.model.AccountProfile;

/** Owner-initiated update. Null fields keep their current value. */
public record ProfileUpdate(String email, String username, AccountProfile profile) {}
