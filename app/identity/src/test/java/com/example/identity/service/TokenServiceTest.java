package com.example.identity.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.identity.config.IdentityTokenProperties;
import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountRole;
import com.example.identity.model.SingleUseTokenPurpose;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenServiceTest {

  private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

  private MutableClock clock;
  private InMemoryAccountStore store;
  private TokenService tokenService;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemoryAccountStore();
    tokenService = new TokenService(IdentityFixtures.tokenProperties(), store, clock);
  }

  @Test
  void accessTokenCarriesSubjectRoleAndAccessTtl() {
    final TokenClaims claims =
        tokenService.verifySigned(tokenService.issueAccess("acc-1", AccountRole.ADMIN));

    assertThat(claims.subject()).isEqualTo("acc-1");
    assertThat(claims.type()).isEqualTo(TokenType.ACCESS);
    assertThat(claims.role()).isEqualTo(AccountRole.ADMIN);
    assertThat(claims.issuedAt()).isEqualTo(START);
    assertThat(claims.expiresAt()).isEqualTo(START.plus(Duration.ofMinutes(30)));
    assertThat(claims.issuer()).isEqualTo("identity-test");
    assertThat(claims.tokenId()).isNotBlank();
    assertThat(tokenService.accessTokenTtlSeconds()).isEqualTo(1800L);
  }

  @Test
  void refreshTokenUsesRefreshTtlInDays() {
    final TokenClaims claims =
        tokenService.verifySigned(tokenService.issueRefresh("acc-1"), TokenType.REFRESH);

    assertThat(claims.type()).isEqualTo(TokenType.REFRESH);
    assertThat(claims.role()).isNull();
    assertThat(claims.expiresAt()).isEqualTo(START.plus(Duration.ofDays(7)));
  }

  @Test
  void tokensAreUniqueEvenWithinOneSecond() {
    assertThat(tokenService.issueAccess("acc-1")).isNotEqualTo(tokenService.issueAccess("acc-1"));
  }

  @Test
  void tokenExpiresExactlyAtTtl() {
    final String token = tokenService.issueAccess("acc-1");

    clock.advance(Duration.ofMinutes(30).minusSeconds(1));
    assertThat(tokenService.verifySigned(token).subject()).isEqualTo("acc-1");

    clock.advance(Duration.ofSeconds(1));
    assertKind(() -> tokenService.verifySigned(token), ErrorKind.TOKEN_EXPIRED);
  }

  @Test
  void wrongTypeIsInvalid() {
    final String refresh = tokenService.issueRefresh("acc-1");

    assertKind(() -> tokenService.verifySigned(refresh, TokenType.ACCESS), ErrorKind.TOKEN_INVALID);
  }

  @Test
  void malformedTokenIsInvalid() {
    assertKind(() -> tokenService.verifySigned("not.a.jwt"), ErrorKind.TOKEN_INVALID);
    assertKind(() -> tokenService.verifySigned(""), ErrorKind.TOKEN_INVALID);
  }

  @Test
  void swappedSignatureIsInvalid() {
    final String first = tokenService.issueAccess("acc-1");
    final String second = tokenService.issueAccess("acc-2");
    final String forged =
        first.substring(0, first.lastIndexOf('.')) + second.substring(second.lastIndexOf('.'));

    assertKind(() -> tokenService.verifySigned(forged), ErrorKind.TOKEN_INVALID);
  }

  @Test
  void tokenFromAnotherSecretOrIssuerIsInvalid() {
    final TokenService otherSecret =
        new TokenService(
            new IdentityTokenProperties(
                "ffffffffffffffffffffffffffffffff", "HS256", "identity-test", null, null, null,
                null),
            store,
            clock);
    final TokenService otherIssuer =
        new TokenService(
            new IdentityTokenProperties(
                IdentityFixtures.SECRET, "HS256", "someone-else", null, null, null, null),
            store,
            clock);

    assertKind(
        () -> tokenService.verifySigned(otherSecret.issueAccess("acc-1")), ErrorKind.TOKEN_INVALID);
    assertKind(
        () -> tokenService.verifySigned(otherIssuer.issueAccess("acc-1")), ErrorKind.TOKEN_INVALID);
  }

  @Test
  void secretTooShortForAlgorithmFailsFast() {
    assertThatThrownBy(
            () ->
                new TokenService(
                    new IdentityTokenProperties(
                        IdentityFixtures.SECRET, "HS512", "identity", null, null, null, null),
                    store,
                    clock))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("HS512");
  }

  @Test
  void singleUseTokenStoresOnlyDigestWithPurposeTtl() {
    final SingleUseToken verification =
        tokenService.issueSingleUse(SingleUseTokenPurpose.EMAIL_VERIFICATION);
    final SingleUseToken reset = tokenService.issueSingleUse(SingleUseTokenPurpose.PASSWORD_RESET);

    assertThat(verification.value()).hasSize(43).doesNotContain("=", "+", "/");
    assertThat(verification.slot().digest())
        .isEqualTo(tokenService.digest(verification.value()))
        .isNotEqualTo(verification.value())
        .hasSize(64);
    assertThat(verification.slot().expiresAt()).isEqualTo(START.plus(Duration.ofHours(24)));
    assertThat(reset.slot().expiresAt()).isEqualTo(START.plus(Duration.ofHours(1)));
    assertThat(verification.toString()).doesNotContain(verification.value());
  }

  @Test
  void consumeSingleUseResolvesAccountUntilExpiry() {
    final SingleUseToken token =
        tokenService.issueSingleUse(SingleUseTokenPurpose.EMAIL_VERIFICATION);
    final AccountRecord saved =
        store.save(
            AccountLifecycle.newPasswordAccount(
                "acc-1", "a@x.com", "alice", "hash", token.slot(), START));

    assertThat(
            tokenService
                .consumeSingleUse(token.value(), SingleUseTokenPurpose.EMAIL_VERIFICATION)
                .id())
        .isEqualTo(saved.id());
    assertKind(
        () -> tokenService.consumeSingleUse(token.value(), SingleUseTokenPurpose.PASSWORD_RESET),
        ErrorKind.TOKEN_INVALID);

    clock.advance(Duration.ofHours(24));
    assertKind(
        () ->
            tokenService.consumeSingleUse(token.value(), SingleUseTokenPurpose.EMAIL_VERIFICATION),
        ErrorKind.TOKEN_EXPIRED);
  }

  @Test
  void unknownSingleUseTokenIsInvalid() {
    assertKind(
        () -> tokenService.consumeSingleUse("unknown", SingleUseTokenPurpose.PASSWORD_RESET),
        ErrorKind.TOKEN_INVALID);
  }

  static void assertKind(Runnable call, ErrorKind kind) {
    assertThatThrownBy(call::run)
        .isInstanceOfSatisfying(
            IdentityException.class, ex -> assertThat(ex.kind()).isEqualTo(kind));
  }
}
