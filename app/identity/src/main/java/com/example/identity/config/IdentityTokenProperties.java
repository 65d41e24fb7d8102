/*
 * どこで: app/identity/src/main/java/com/example/identity/config/IdentityTokenProperties.java
 * 何を: 署名トークンと単回トークンの設定値
 * なぜ: 秘密鍵や TTL をコードへ埋め込まず、起動時に検証して不正設定で起動させないため
 */
package com.example.identity.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "identity.token")
public record IdentityTokenProperties(
    @NotBlank String secret,
    @Pattern(regexp = "HS256|HS384|HS512") String algorithm,
    String issuer,
    @DurationUnit(ChronoUnit.MINUTES) Duration accessTokenTtl,
    @DurationUnit(ChronoUnit.DAYS) Duration refreshTokenTtl,
    @DurationUnit(ChronoUnit.HOURS) Duration emailVerificationTtl,
    @DurationUnit(ChronoUnit.HOURS) Duration passwordResetTtl) {

  public static final int MIN_SECRET_BYTES = 32;

  public IdentityTokenProperties {
    algorithm = algorithm == null || algorithm.isBlank() ? "HS256" : algorithm;
    issuer = issuer == null || issuer.isBlank() ? "identity" : issuer;
    accessTokenTtl = accessTokenTtl == null ? Duration.ofMinutes(30) : accessTokenTtl;
    refreshTokenTtl = refreshTokenTtl == null ? Duration.ofDays(7) : refreshTokenTtl;
    emailVerificationTtl =
        emailVerificationTtl == null ? Duration.ofHours(24) : emailVerificationTtl;
    passwordResetTtl = passwordResetTtl == null ? Duration.ofHours(1) : passwordResetTtl;
  }

  @AssertTrue(message = "identity.token.secret must be at least 32 bytes")
  public boolean isSecretLongEnough() {
    return secret == null || secret.getBytes(StandardCharsets.UTF_8).length >= MIN_SECRET_BYTES;
  }

  @AssertTrue(message = "token TTLs must be positive")
  public boolean isTtlPositive() {
    return !accessTokenTtl.isNegative()
        && !accessTokenTtl.isZero()
        && !refreshTokenTtl.isNegative()
        && !refreshTokenTtl.isZero()
        && !emailVerificationTtl.isNegative()
        && !emailVerificationTtl.isZero()
        && !passwordResetTtl.isNegative()
        && !passwordResetTtl.isZero();
  }
}
