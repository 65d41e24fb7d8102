package com.example.identity.service;

import com.example.identity.model.SingleUseTokenPurpose;
import com.example.identity.model.SingleUseTokenSlot;

/**
 * A freshly issued single-use token.
 *
 * @param value plaintext handed to the account owner exactly once
 * @param slot what gets persisted on the account
 */
public record SingleUseToken(String value, SingleUseTokenPurpose purpose, SingleUseTokenSlot slot) {

  @Override
  public String toString() {
    return "SingleUseToken[purpose=" + purpose + ", expiresAt=" + slot.expiresAt() + "]";
  }
}
