/*
 * どこで: app/identity/src/main/java/com/example/identity/service/TokenService.java
 * 何を: 署名付き access/refresh トークンと、アカウントに保存する単回トークンの発行・検証
 * なぜ: 署名検証はストアを参照せずに完結させ、単回トークンは平文を保存しない形に揃えるため
 */
package com.example.identity.service;

import com.example.identity.config.IdentityTokenProperties;
import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountRole;
import com.example.identity.model.SingleUseTokenPurpose;
import com.example.identity.model.SingleUseTokenSlot;
import com.example.identity.repository.AccountStore;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.KeyLengthException;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;
import java.util.HexFormat;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TokenService {

  private static final Logger logger = LoggerFactory.getLogger(TokenService.class);
  private static final String CLAIM_TYPE = "type";
  private static final String CLAIM_ROLE = "role";
  private static final int SINGLE_USE_BYTES = 32;

  private final IdentityTokenProperties properties;
  private final AccountStore accountStore;
  private final Clock clock;
  private final JWSAlgorithm algorithm;
  private final MACSigner signer;
  private final MACVerifier verifier;
  private final SecureRandom secureRandom = new SecureRandom();

  public TokenService(IdentityTokenProperties properties, AccountStore accountStore, Clock clock) {
    this.properties = properties;
    this.accountStore = accountStore;
    this.clock = clock;
    this.algorithm = JWSAlgorithm.parse(properties.algorithm());
    final byte[] secret = properties.secret().getBytes(StandardCharsets.UTF_8);
    try {
      this.signer = new MACSigner(secret);
      this.verifier = new MACVerifier(secret);
    } catch (KeyLengthException ex) {
      throw new IllegalStateException("identity.token.secret is too short for " + algorithm, ex);
    } catch (JOSEException ex) {
      throw new IllegalStateException("failed to initialise token signer", ex);
    }
    if (!signer.supportedJWSAlgorithms().contains(algorithm)) {
      throw new IllegalStateException(
          "identity.token.secret is too short for " + algorithm.getName());
    }
  }

  public String issueAccess(String subjectId, AccountRole role) {
    return sign(subjectId, TokenType.ACCESS, role, properties.accessTokenTtl());
  }

  public String issueAccess(String subjectId) {
    return issueAccess(subjectId, null);
  }

  public String issueRefresh(String subjectId) {
    return sign(subjectId, TokenType.REFRESH, null, properties.refreshTokenTtl());
  }

  public long accessTokenTtlSeconds() {
    return properties.accessTokenTtl().toSeconds();
  }

  /**
   * Checks signature, algorithm, issuer and expiry without touching the store.
   *
   * @throws IdentityException {@link ErrorKind#TOKEN_EXPIRED} once {@code exp} is reached,
   *     {@link ErrorKind#TOKEN_INVALID} for anything malformed or not signed by this service
   */
  public TokenClaims verifySigned(String token) {
    if (token == null || token.isBlank()) {
      throw IdentityException.tokenInvalid("token is required");
    }
    final SignedJWT jwt;
    final JWTClaimsSet claims;
    try {
      jwt = SignedJWT.parse(token);
      claims = jwt.getJWTClaimsSet();
    } catch (ParseException ex) {
      throw IdentityException.tokenInvalid("token is malformed");
    }
    if (!algorithm.equals(jwt.getHeader().getAlgorithm())) {
      throw IdentityException.tokenInvalid("unexpected token algorithm");
    }
    try {
      if (!jwt.verify(verifier)) {
        throw IdentityException.tokenInvalid("token signature is invalid");
      }
    } catch (JOSEException ex) {
      logger.debug("token verification error: {}", ex.getMessage());
      throw IdentityException.tokenInvalid("token signature is invalid");
    }
    return toClaims(claims);
  }

  public TokenClaims verifySigned(String token, TokenType expectedType) {
    final TokenClaims claims = verifySigned(token);
    if (claims.type() != expectedType) {
      throw IdentityException.tokenInvalid("expected a " + expectedType.claimValue() + " token");
    }
    return claims;
  }

  public SingleUseToken issueSingleUse(SingleUseTokenPurpose purpose) {
    return issueSingleUse(purpose, ttlFor(purpose));
  }

  public SingleUseToken issueSingleUse(SingleUseTokenPurpose purpose, Duration ttl) {
    final byte[] bytes = new byte[SINGLE_USE_BYTES];
    secureRandom.nextBytes(bytes);
    final String value = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    final Instant expiresAt = clock.instant().plus(ttl);
    return new SingleUseToken(value, purpose, new SingleUseTokenSlot(digest(value), expiresAt));
  }

  /**
   * Resolves the account holding {@code value} for {@code purpose}. The caller clears the slot in
   * the same conditional write as the mutation the token authorises.
   */
  public AccountRecord consumeSingleUse(String value, SingleUseTokenPurpose purpose) {
    if (value == null || value.isBlank()) {
      throw IdentityException.tokenInvalid("token is required");
    }
    final AccountRecord account =
        accountStore
            .findBySingleUseToken(digest(value), purpose)
            .orElseThrow(() -> IdentityException.tokenInvalid("token is invalid or already used"));
    final SingleUseTokenSlot slot = account.tokenFor(purpose);
    if (slot == null || slot.isExpiredAt(clock.instant())) {
      throw IdentityException.tokenExpired("token has expired");
    }
    return account;
  }

  public String digest(String value) {
    try {
      final MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(sha256.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }

  private Duration ttlFor(SingleUseTokenPurpose purpose) {
    return switch (purpose) {
      case EMAIL_VERIFICATION -> properties.emailVerificationTtl();
      case PASSWORD_RESET -> properties.passwordResetTtl();
    };
  }

  private String sign(String subjectId, TokenType type, AccountRole role, Duration ttl) {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("subjectId is required");
    }
    // JWT の時刻は秒精度
    final Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    final JWTClaimsSet.Builder claims =
        new JWTClaimsSet.Builder()
            .subject(subjectId)
            .issuer(properties.issuer())
            .issueTime(Date.from(issuedAt))
            .expirationTime(Date.from(issuedAt.plus(ttl)))
            .jwtID(UUID.randomUUID().toString())
            .claim(CLAIM_TYPE, type.claimValue());
    if (role != null) {
      claims.claim(CLAIM_ROLE, role.name());
    }
    final SignedJWT jwt =
        new SignedJWT(
            new JWSHeader.Builder(algorithm).type(JOSEObjectType.JWT).build(), claims.build());
    try {
      jwt.sign(signer);
    } catch (JOSEException ex) {
      throw new IllegalStateException("failed to sign token", ex);
    }
    return jwt.serialize();
  }

  private TokenClaims toClaims(JWTClaimsSet claims) {
    final String subject = claims.getSubject();
    final Date issueTime = claims.getIssueTime();
    final Date expirationTime = claims.getExpirationTime();
    if (subject == null || subject.isBlank() || issueTime == null || expirationTime == null) {
      throw IdentityException.tokenInvalid("token is missing required claims");
    }
    if (!properties.issuer().equals(claims.getIssuer())) {
      throw IdentityException.tokenInvalid("token issuer is not accepted");
    }
    final String typeClaim;
    final String roleClaim;
    try {
      typeClaim = claims.getStringClaim(CLAIM_TYPE);
      roleClaim = claims.getStringClaim(CLAIM_ROLE);
    } catch (ParseException ex) {
      throw IdentityException.tokenInvalid("token claims are malformed");
    }
    final Instant expiresAt = expirationTime.toInstant();
    if (!expiresAt.isAfter(clock.instant())) {
      throw IdentityException.tokenExpired("token has expired");
    }
    final AccountRole role;
    try {
      role = roleClaim == null ? null : AccountRole.valueOf(roleClaim);
    } catch (IllegalArgumentException ex) {
      throw IdentityException.tokenInvalid("token role is unknown");
    }
    return new TokenClaims(
        subject,
        TokenType.fromClaim(typeClaim),
        role,
        issueTime.toInstant(),
        expiresAt,
        claims.getJWTID(),
        claims.getIssuer());
  }
}
