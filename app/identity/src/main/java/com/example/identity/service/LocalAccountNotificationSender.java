/*
 * どこで: Identity サービス層
 * 何を: トークン送信を模擬する実装
 * なぜ: 外部送信を伴わずに登録/リセットの流れを確認するため
 */
package com.example.identity.service;

import com.example.identity.model.AccountRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalAccountNotificationSender implements AccountNotificationSender {

  private static final Logger logger =
      LoggerFactory.getLogger(LocalAccountNotificationSender.class);

  @Override
  public void sendEmailVerification(AccountRecord account, SingleUseToken token) {
    // トークン値はログに出さない
    logger.info(
        "email verification simulated send accountId={} expiresAt={}",
        account.id(),
        token.slot().expiresAt());
  }

  @Override
  public void sendPasswordReset(AccountRecord account, SingleUseToken token) {
    logger.info(
        "password reset simulated send accountId={} expiresAt={}",
        account.id(),
        token.slot().expiresAt());
  }
}
