/*
 * どこで: app/identity/src/main/java/com/example/identity/service/AccountLifecycle.java
 * 何を: アカウント状態の遷移表と、状態に依存する全ての変更操作
 * なぜ: status をフィールド直書きで更新させず、到達不能な遷移を IllegalTransition で一律に拒否するため
 */
package com.example.identity.service;

import com.example.identity.model.AccountProfile;
import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountRole;
import com.example.identity.model.AccountStatus;
import com.example.identity.model.ExternalIdentity;
import com.example.identity.model.LifecycleEvent;
import com.example.identity.model.SingleUseTokenPurpose;
import com.example.identity.model.SingleUseTokenSlot;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Central transition table for {@link AccountStatus}.
 *
 * <p>Every method returns a new {@link AccountRecord}; nothing here touches storage. Any operation
 * addressed to a DELETED account is rejected with {@link ErrorKind#ILLEGAL_TRANSITION}.
 */
public final class AccountLifecycle {

  private record Transition(Set<AccountStatus> from, AccountStatus to, boolean active) {}

  private static final Set<AccountStatus> NON_TERMINAL =
      EnumSet.of(
          AccountStatus.PENDING,
          AccountStatus.ACTIVE,
          AccountStatus.INACTIVE,
          AccountStatus.SUSPENDED);

  private static final Set<AccountStatus> ESTABLISHED =
      EnumSet.of(AccountStatus.ACTIVE, AccountStatus.INACTIVE, AccountStatus.SUSPENDED);

  private static final Map<LifecycleEvent, Transition> TRANSITIONS =
      new EnumMap<>(LifecycleEvent.class);

  static {
    TRANSITIONS.put(
        LifecycleEvent.ACTIVATE, new Transition(ESTABLISHED, AccountStatus.ACTIVE, true));
    TRANSITIONS.put(
        LifecycleEvent.DEACTIVATE, new Transition(ESTABLISHED, AccountStatus.INACTIVE, false));
    TRANSITIONS.put(
        LifecycleEvent.SUSPEND, new Transition(NON_TERMINAL, AccountStatus.SUSPENDED, false));
    TRANSITIONS.put(
        LifecycleEvent.SOFT_DELETE, new Transition(NON_TERMINAL, AccountStatus.DELETED, false));
  }

  private AccountLifecycle() {}

  public static boolean canApply(AccountStatus from, LifecycleEvent event) {
    return TRANSITIONS.get(event).from().contains(from);
  }

  /** Password registration: PENDING, inactive and unverified until the email is confirmed. */
  public static AccountRecord newPasswordAccount(
      String id,
      String email,
      String username,
      String passwordHash,
      SingleUseTokenSlot verificationToken,
      Instant now) {
    return AccountRecord.builder()
        .id(id)
        .email(email)
        .username(username)
        .passwordHash(passwordHash)
        .emailVerified(false)
        .verificationToken(verificationToken)
        .profile(AccountProfile.empty())
        .role(AccountRole.USER)
        .status(AccountStatus.PENDING)
        .active(false)
        .createdAt(now)
        .updatedAt(now)
        .version(0L)
        .build();
  }

  /** First sighting of an external identity: the provider has already verified the email. */
  public static AccountRecord newExternalAccount(
      String id,
      String email,
      String username,
      ExternalIdentity externalIdentity,
      AccountProfile profile,
      Instant now) {
    return AccountRecord.builder()
        .id(id)
        .email(email)
        .username(username)
        .externalIdentity(externalIdentity)
        .emailVerified(true)
        .profile(profile)
        .role(AccountRole.USER)
        .status(AccountStatus.ACTIVE)
        .active(true)
        .createdAt(now)
        .updatedAt(now)
        .version(0L)
        .build();
  }

  public static AccountRecord apply(AccountRecord account, LifecycleEvent event, Instant now) {
    final Transition transition = TRANSITIONS.get(event);
    if (!transition.from().contains(account.status())) {
      throw IdentityException.illegalTransition(
          "cannot " + event + " account in status " + account.status());
    }
    final AccountRecord.AccountRecordBuilder builder =
        account.toBuilder().status(transition.to()).active(transition.active()).updatedAt(now);
    if (event == LifecycleEvent.SOFT_DELETE) {
      // 削除後は単回トークンを消費できないようにする
      builder.deletedAt(now).verificationToken(null).passwordResetToken(null);
    }
    return builder.build();
  }

  /**
   * Consumes the verification slot. PENDING accounts become ACTIVE; other live statuses only gain
   * the verified flag.
   */
  public static AccountRecord verifyEmail(AccountRecord account, Instant now) {
    requireLive(account, "verify email of");
    final AccountRecord.AccountRecordBuilder builder =
        account.toBuilder().emailVerified(true).verificationToken(null).updatedAt(now);
    if (account.status() == AccountStatus.PENDING) {
      builder.status(AccountStatus.ACTIVE).active(true);
    }
    return builder.build();
  }

  public static AccountRecord changeRole(AccountRecord account, AccountRole role, Instant now) {
    requireLive(account, "change role of");
    return account.toBuilder().role(role).updatedAt(now).build();
  }

  /** Stores a new password digest and invalidates any outstanding reset token. */
  public static AccountRecord replacePassword(
      AccountRecord account, String passwordHash, Instant now) {
    requireLive(account, "change password of");
    return account.toBuilder()
        .passwordHash(passwordHash)
        .passwordResetToken(null)
        .updatedAt(now)
        .build();
  }

  public static AccountRecord assignToken(
      AccountRecord account, SingleUseTokenPurpose purpose, SingleUseTokenSlot slot, Instant now) {
    requireLive(account, "issue token for");
    final AccountRecord.AccountRecordBuilder builder = account.toBuilder().updatedAt(now);
    return switch (purpose) {
      case EMAIL_VERIFICATION -> builder.verificationToken(slot).build();
      case PASSWORD_RESET -> builder.passwordResetToken(slot).build();
    };
  }

  public static AccountRecord linkExternalIdentity(
      AccountRecord account, ExternalIdentity externalIdentity, Instant now) {
    requireLive(account, "link identity to");
    return account.toBuilder().externalIdentity(externalIdentity).updatedAt(now).build();
  }

  /**
   * Applies an owner-initiated profile update. A changed email drops the verified flag and installs
   * {@code newVerificationToken}.
   */
  public static AccountRecord updateProfile(
      AccountRecord account,
      String email,
      String username,
      AccountProfile profilePatch,
      SingleUseTokenSlot newVerificationToken,
      Instant now) {
    requireLive(account, "update profile of");
    final AccountRecord.AccountRecordBuilder builder =
        account.toBuilder().profile(account.profile().merge(profilePatch)).updatedAt(now);
    if (username != null) {
      builder.username(username);
    }
    if (email != null && !email.equals(account.email())) {
      builder.email(email).emailVerified(false).verificationToken(newVerificationToken);
    }
    return builder.build();
  }

  private static void requireLive(AccountRecord account, String action) {
    if (account.status().isTerminal()) {
      throw IdentityException.illegalTransition(
          "cannot " + action + " account in status " + account.status());
    }
  }
}
