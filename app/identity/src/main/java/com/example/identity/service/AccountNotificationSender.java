/*
 * どこで: Identity サービス層
 * 何を: 単回トークンをアカウント所有者へ届ける送信口
 * なぜ: メール等の実送信手段とテスト用の捕捉実装を差し替え可能にするため
 */
package com.example.identity.service;

import com.example.identity.model.AccountRecord;

public interface AccountNotificationSender {

  void sendEmailVerification(AccountRecord account, SingleUseToken token);

  void sendPasswordReset(AccountRecord account, SingleUseToken token);
}
