/*
 * どこで: app/identity/src/main/java/com/example/identity/service/AccountInputPolicy.java
 * 何を: email/username の正規化とパスワード長の検査
 * なぜ: 大文字小文字違いの重複登録を防ぎ、保存値と検索値を常に同じ形へ揃えるため
 */
package com.example.identity.service;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

final class AccountInputPolicy {

  static final int PASSWORD_MIN_LENGTH = 8;
  // bcrypt は 72 バイトを超える入力を無視する
  static final int PASSWORD_MAX_BYTES = 72;
  static final int USERNAME_MIN_LENGTH = 3;
  static final int USERNAME_MAX_LENGTH = 50;
  static final int EMAIL_MAX_LENGTH = 255;

  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
  private static final Pattern USERNAME = Pattern.compile("^[a-z0-9._-]+$");
  private static final Pattern USERNAME_ILLEGAL = Pattern.compile("[^a-z0-9._-]");

  private AccountInputPolicy() {}

  /** Lenient form used for lookups: trims and lower-cases, no format check. */
  static String foldEmail(String email) {
    return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
  }

  static String normalizeEmail(String email) {
    final String folded = foldEmail(email);
    if (folded == null || folded.isEmpty()) {
      throw IdentityException.validation("email is required");
    }
    if (folded.length() > EMAIL_MAX_LENGTH || !EMAIL.matcher(folded).matches()) {
      throw IdentityException.validation("email is malformed");
    }
    return folded;
  }

  static String normalizeUsername(String username) {
    final String folded = username == null ? "" : username.trim().toLowerCase(Locale.ROOT);
    if (folded.isEmpty()) {
      throw IdentityException.validation("username is required");
    }
    if (folded.length() < USERNAME_MIN_LENGTH || folded.length() > USERNAME_MAX_LENGTH) {
      throw IdentityException.validation(
          "username must be " + USERNAME_MIN_LENGTH + ".." + USERNAME_MAX_LENGTH + " characters");
    }
    if (!USERNAME.matcher(folded).matches()) {
      throw IdentityException.validation(
          "username may contain only letters, digits, '.', '_' and '-'");
    }
    return folded;
  }

  static void validatePassword(String password) {
    if (password == null || password.length() < PASSWORD_MIN_LENGTH) {
      throw IdentityException.validation(
          "password must be at least " + PASSWORD_MIN_LENGTH + " characters");
    }
    if (password.getBytes(StandardCharsets.UTF_8).length > PASSWORD_MAX_BYTES) {
      throw IdentityException.validation(
          "password must be at most " + PASSWORD_MAX_BYTES + " bytes");
    }
  }

  /** Derives a username candidate from the local part of an email address. */
  static String usernameFromEmail(String email) {
    final String localPart = email.substring(0, email.indexOf('@'));
    String candidate = USERNAME_ILLEGAL.matcher(localPart).replaceAll("");
    if (candidate.length() > USERNAME_MAX_LENGTH - 7) {
      candidate = candidate.substring(0, USERNAME_MAX_LENGTH - 7);
    }
    if (candidate.length() < USERNAME_MIN_LENGTH) {
      candidate = "user" + candidate;
    }
    return candidate;
  }
}
