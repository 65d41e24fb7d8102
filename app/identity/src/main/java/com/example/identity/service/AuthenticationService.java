/*
 * どこで: app/identity/src/main/java/com/example/identity/service/AuthenticationService.java
 * 何を: 登録・ログイン・外部 IdP ログイン・パスワード/メール確認フローの組み立て
 * なぜ: ハッシュ計算やトークン発行を個別サービスへ委譲し、状態変更は AccountLifecycle を経由させるため
 */
package com.example.identity.service;

import com.example.identity.config.ClientAddressResolver;
import com.example.identity.model.AccountProfile;
import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountStatus;
import com.example.identity.model.ExternalIdentity;
import com.example.identity.model.SingleUseTokenPurpose;
import com.example.identity.repository.AccountStore;
import com.example.identity.repository.StaleAccountException;
import com.example.identity.repository.UniqueConstraintViolationException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for every credential-related command.
 *
 * <p>Not transactional: password hashing runs on the credential pool and must not hold a
 * connection. Each store write is a single conditional statement, and races are resolved through
 * the store's unique constraints and version column.
 */
@Service
@RequiredArgsConstructor
public class AuthenticationService {

  private static final Logger logger = LoggerFactory.getLogger(AuthenticationService.class);
  private static final int EXTERNAL_LOGIN_ATTEMPTS = 4;
  private static final SecureRandom SUFFIX_RANDOM = new SecureRandom();

  private final AccountStore accountStore;
  private final CredentialService credentialService;
  private final TokenService tokenService;
  private final AccountNotificationSender notificationSender;
  private final IdentityMetrics metrics;
  private final Clock clock;

  public RegistrationResult register(RegisterCommand command) {
    return measured("register", () -> doRegister(command));
  }

  private RegistrationResult doRegister(RegisterCommand command) {
    final String email = AccountInputPolicy.normalizeEmail(command.email());
    final String username = AccountInputPolicy.normalizeUsername(command.username());
    final boolean passwordAccount = command.password() != null;
    if (!passwordAccount && !command.hasExternalIdentity()) {
      throw IdentityException.validation("password or external identity is required");
    }
    if (passwordAccount) {
      AccountInputPolicy.validatePassword(command.password());
    }
    if (accountStore.existsByEmail(email, true)) {
      throw IdentityException.conflict("email is already registered");
    }
    if (accountStore.existsByUsername(username, true)) {
      throw IdentityException.conflict("username is already taken");
    }
    final ExternalIdentity externalIdentity =
        command.hasExternalIdentity()
            ? new ExternalIdentity(command.provider().trim(), command.providerId().trim())
            : null;
    if (externalIdentity != null
        && accountStore
            .findByExternalIdentity(externalIdentity.provider(), externalIdentity.providerId())
            .isPresent()) {
      throw IdentityException.conflict("external identity is already registered");
    }

    final Instant now = clock.instant();
    final String accountId = UUID.randomUUID().toString();
    if (!passwordAccount) {
      final AccountRecord created =
          insert(
              AccountLifecycle.newExternalAccount(
                  accountId,
                  email,
                  username,
                  externalIdentity,
                  profileOrEmpty(command.profile()),
                  now));
      logger.info(
          "account registered accountId={} provider={}",
          created.id(),
          externalIdentity.provider());
      return toRegistrationResult(created);
    }

    final String passwordHash = credentialService.hash(command.password());
    final SingleUseToken verification =
        tokenService.issueSingleUse(SingleUseTokenPurpose.EMAIL_VERIFICATION);
    final AccountRecord pending =
        AccountLifecycle.newPasswordAccount(
                accountId, email, username, passwordHash, verification.slot(), now)
            .toBuilder()
            .externalIdentity(externalIdentity)
            .profile(profileOrEmpty(command.profile()))
            .build();
    final AccountRecord created = insert(pending);
    logger.info("account registered accountId={} status={}", created.id(), created.status());
    notificationSender.sendEmailVerification(created, verification);
    return toRegistrationResult(created);
  }

  /**
   * Password sign-in.
   *
   * <p>The password is checked before the status so that a wrong password never reveals whether an
   * account is suspended.
   */
  public AuthResult login(String email, String password, String originAddress) {
    return measured("login", () -> doLogin(email, password, originAddress));
  }

  private AuthResult doLogin(String email, String password, String originAddress) {
    if (email == null || email.isBlank() || password == null || password.isEmpty()) {
      throw IdentityException.validation("email and password are required");
    }
    final Optional<AccountRecord> found =
        accountStore.findByEmail(AccountInputPolicy.foldEmail(email));
    if (found.isEmpty() || !found.get().hasPassword()) {
      // 未登録でも照合 1 回分の時間をかける
      credentialService.verifyDecoy(password);
      throw IdentityException.invalidCredentials();
    }
    final AccountRecord account = found.get();
    if (!credentialService.verify(password, account.passwordHash())) {
      logger.info("login rejected accountId={} reason=password_mismatch", account.id());
      throw IdentityException.invalidCredentials();
    }
    return completeLogin(account, originAddress);
  }

  public ExternalLoginResult externalLogin(ExternalLoginCommand command) {
    return measured("external_login", () -> doExternalLogin(command));
  }

  private ExternalLoginResult doExternalLogin(ExternalLoginCommand command) {
    if (command.provider() == null || command.provider().isBlank()
        || command.providerId() == null || command.providerId().isBlank()) {
      throw IdentityException.validation("provider and providerId are required");
    }
    final ExternalIdentity identity =
        new ExternalIdentity(command.provider().trim(), command.providerId().trim());

    boolean suffixUsername = false;
    for (int attempt = 1; attempt <= EXTERNAL_LOGIN_ATTEMPTS; attempt++) {
      final Optional<AccountRecord> known =
          accountStore.findByExternalIdentity(identity.provider(), identity.providerId());
      if (known.isPresent()) {
        return new ExternalLoginResult(completeLogin(known.get(), command.originAddress()), false);
      }

      final String email = AccountInputPolicy.normalizeEmail(command.email());
      final Optional<AccountRecord> sameEmail =
          accountStore.findByEmail(email).filter(account -> !account.isDeleted());
      try {
        if (sameEmail.isPresent()) {
          final AccountRecord linked = link(sameEmail.get(), identity);
          return new ExternalLoginResult(completeLogin(linked, command.originAddress()), false);
        }
        final String username = chooseUsername(command, email, suffixUsername);
        final AccountRecord created =
            accountStore.save(
                AccountLifecycle.newExternalAccount(
                    UUID.randomUUID().toString(),
                    email,
                    username,
                    identity,
                    profileOrEmpty(command.profile()),
                    clock.instant()));
        logger.info(
            "account created from external identity accountId={} provider={}",
            created.id(),
            identity.provider());
        return new ExternalLoginResult(completeLogin(created, command.originAddress()), true);
      } catch (UniqueConstraintViolationException ex) {
        switch (ex.constraint()) {
          case EXTERNAL_IDENTITY, EMAIL -> logger.info(
              "external login lost creation race provider={} constraint={} attempt={}",
              identity.provider(),
              ex.constraint(),
              attempt);
          case USERNAME -> suffixUsername = true;
          default -> throw IdentityException.conflict("account could not be created");
        }
      } catch (StaleAccountException ex) {
        logger.info("external login link raced accountId={} attempt={}", ex.accountId(), attempt);
      }
    }
    throw IdentityException.conflict("external identity could not be reconciled, retry");
  }

  private AccountRecord link(AccountRecord account, ExternalIdentity identity) {
    if (identity.equals(account.externalIdentity())) {
      // created by a concurrent caller between the two lookups
      return account;
    }
    if (account.externalIdentity() != null || !account.emailVerified()) {
      throw IdentityException.conflict("email is already registered with another sign-in method");
    }
    final AccountRecord linked =
        accountStore.save(
            AccountLifecycle.linkExternalIdentity(account, identity, clock.instant()));
    logger.info(
        "external identity linked accountId={} provider={}", linked.id(), identity.provider());
    return linked;
  }

  private String chooseUsername(ExternalLoginCommand command, String email, boolean suffix) {
    String base;
    if (command.username() != null && !command.username().isBlank()) {
      base = AccountInputPolicy.normalizeUsername(command.username());
    } else {
      base = AccountInputPolicy.usernameFromEmail(email);
    }
    if (!suffix && !accountStore.existsByUsername(base, true)) {
      return base;
    }
    final byte[] random = new byte[3];
    SUFFIX_RANDOM.nextBytes(random);
    if (base.length() > AccountInputPolicy.USERNAME_MAX_LENGTH - 7) {
      base = base.substring(0, AccountInputPolicy.USERNAME_MAX_LENGTH - 7);
    }
    return base + "-" + HexFormat.of().formatHex(random);
  }

  public void changePassword(String accountId, String currentPassword, String newPassword) {
    measured(
        "change_password",
        () -> {
          AccountInputPolicy.validatePassword(newPassword);
          final AccountRecord account = requireLiveAccount(accountId);
          if (!account.hasPassword()) {
            throw IdentityException.noPasswordSet();
          }
          if (currentPassword == null
              || !credentialService.verify(currentPassword, account.passwordHash())) {
            throw IdentityException.invalidCredentials();
          }
          final String passwordHash = credentialService.hash(newPassword);
          try {
            accountStore.save(
                AccountLifecycle.replacePassword(account, passwordHash, clock.instant()));
          } catch (StaleAccountException ex) {
            throw IdentityException.conflict("account was modified concurrently, retry");
          }
          logger.info("password changed accountId={}", accountId);
          return null;
        });
  }

  /**
   * Always acknowledges. A reset token is issued only for a live account that has a password;
   * store failures still surface as {@link InfrastructureException}.
   */
  public void requestPasswordReset(String email) {
    metrics.recordAuthResult("password_reset_request", "acknowledged");
    final String folded = AccountInputPolicy.foldEmail(email);
    if (folded == null || folded.isEmpty()) {
      return;
    }
    final Optional<AccountRecord> account =
        accountStore.findByEmail(folded).filter(a -> !a.isDeleted() && a.hasPassword());
    if (account.isEmpty()) {
      logger.debug("password reset requested for unknown or ineligible email");
      return;
    }
    final SingleUseToken token = tokenService.issueSingleUse(SingleUseTokenPurpose.PASSWORD_RESET);
    final AccountRecord updated;
    try {
      updated =
          accountStore.save(
              AccountLifecycle.assignToken(
                  account.get(),
                  SingleUseTokenPurpose.PASSWORD_RESET,
                  token.slot(),
                  clock.instant()));
    } catch (StaleAccountException | UniqueConstraintViolationException ex) {
      logger.warn(
          "password reset token not stored accountId={} cause={}",
          account.get().id(),
          ex.getClass().getSimpleName());
      return;
    }
    logger.info("password reset token issued accountId={}", updated.id());
    notificationSender.sendPasswordReset(updated, token);
  }

  public void confirmPasswordReset(String token, String newPassword) {
    measured(
        "password_reset_confirm",
        () -> {
          AccountInputPolicy.validatePassword(newPassword);
          final AccountRecord account =
              tokenService.consumeSingleUse(token, SingleUseTokenPurpose.PASSWORD_RESET);
          final String passwordHash = credentialService.hash(newPassword);
          try {
            accountStore.save(
                AccountLifecycle.replacePassword(account, passwordHash, clock.instant()));
          } catch (StaleAccountException ex) {
            throw IdentityException.tokenInvalid("token is invalid or already used");
          }
          logger.info("password reset completed accountId={}", account.id());
          return null;
        });
  }

  /** Consumes a verification token. Returns the account state after verification. */
  public AccountRecord verifyEmail(String token) {
    return measured(
        "verify_email",
        () -> {
          final AccountRecord account =
              tokenService.consumeSingleUse(token, SingleUseTokenPurpose.EMAIL_VERIFICATION);
          final AccountRecord verified;
          try {
            verified =
                accountStore.save(AccountLifecycle.verifyEmail(account, clock.instant()));
          } catch (StaleAccountException ex) {
            throw IdentityException.tokenInvalid("token is invalid or already used");
          }
          logger.info(
              "email verified accountId={} status={}", verified.id(), verified.status());
          return verified;
        });
  }

  public AuthResult refresh(String refreshToken) {
    return measured(
        "refresh",
        () -> {
          final TokenClaims claims = tokenService.verifySigned(refreshToken, TokenType.REFRESH);
          final AccountRecord account =
              accountStore
                  .findById(claims.subject())
                  .orElseThrow(() -> IdentityException.tokenInvalid("token subject is unknown"));
          if (account.status() != AccountStatus.ACTIVE) {
            throw IdentityException.accountInactive("account is " + account.status());
          }
          return issueTokens(account);
        });
  }

  public void resendEmailVerification(String accountId) {
    measured(
        "resend_verification",
        () -> {
          final AccountRecord account = requireLiveAccount(accountId);
          if (account.emailVerified()) {
            throw IdentityException.conflict("email is already verified");
          }
          final SingleUseToken token =
              tokenService.issueSingleUse(SingleUseTokenPurpose.EMAIL_VERIFICATION);
          final AccountRecord updated;
          try {
            updated =
                accountStore.save(
                    AccountLifecycle.assignToken(
                        account,
                        SingleUseTokenPurpose.EMAIL_VERIFICATION,
                        token.slot(),
                        clock.instant()));
          } catch (StaleAccountException ex) {
            throw IdentityException.conflict("account was modified concurrently, retry");
          }
          notificationSender.sendEmailVerification(updated, token);
          return null;
        });
  }

  private AuthResult completeLogin(AccountRecord account, String originAddress) {
    if (account.status() != AccountStatus.ACTIVE) {
      logger.info("login rejected accountId={} status={}", account.id(), account.status());
      throw IdentityException.accountInactive("account is " + account.status());
    }
    final String address =
        ClientAddressResolver.isAddressLiteral(originAddress) ? originAddress : null;
    if (!accountStore.recordLogin(account.id(), clock.instant(), address)) {
      throw IdentityException.accountInactive("account is no longer active");
    }
    logger.info("login succeeded accountId={}", account.id());
    return issueTokens(account);
  }

  private AuthResult issueTokens(AccountRecord account) {
    return new AuthResult(
        account.id(),
        tokenService.issueAccess(account.id(), account.role()),
        tokenService.issueRefresh(account.id()),
        AuthResult.BEARER,
        tokenService.accessTokenTtlSeconds());
  }

  private AccountRecord insert(AccountRecord account) {
    try {
      return accountStore.save(account);
    } catch (UniqueConstraintViolationException ex) {
      throw switch (ex.constraint()) {
        case EMAIL -> IdentityException.conflict("email is already registered");
        case USERNAME -> IdentityException.conflict("username is already taken");
        case EXTERNAL_IDENTITY -> IdentityException.conflict(
            "external identity is already registered");
        default -> IdentityException.conflict("account could not be created");
      };
    }
  }

  private AccountRecord requireLiveAccount(String accountId) {
    return accountStore
        .findById(accountId)
        .filter(account -> !account.isDeleted())
        .orElseThrow(() -> IdentityException.notFound("account not found"));
  }

  private static AccountProfile profileOrEmpty(AccountProfile profile) {
    return profile == null ? AccountProfile.empty() : profile;
  }

  private static RegistrationResult toRegistrationResult(AccountRecord account) {
    return new RegistrationResult(
        account.id(), account.email(), account.username(), account.status());
  }

  private <T> T measured(String action, Supplier<T> body) {
    try {
      final T result = body.get();
      metrics.recordAuthResult(action, "success");
      return result;
    } catch (IdentityException ex) {
      metrics.recordFailure(action, ex);
      throw ex;
    }
  }
}
