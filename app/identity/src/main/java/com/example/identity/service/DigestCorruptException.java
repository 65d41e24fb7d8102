package com.example.identity.service;

/** 保存済みパスワードダイジェストが bcrypt 形式として読めない。 */
public class DigestCorruptException extends IllegalStateException {

  public DigestCorruptException(String message) {
    super(message);
  }
}
