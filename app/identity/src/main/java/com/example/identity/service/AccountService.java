package com.example.identity.service;

import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountSearchCriteria;
import com.example.identity.model.AccountStatistics;
import com.example.identity.model.SingleUseTokenPurpose;
import com.example.identity.repository.AccountStore;
import com.example.identity.repository.StaleAccountException;
import com.example.identity.repository.UniqueConstraintViolationException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AccountService {

  private static final Logger logger = LoggerFactory.getLogger(AccountService.class);

  private final AccountStore accountStore;
  private final TokenService tokenService;
  private final AccountNotificationSender notificationSender;
  private final Clock clock;

  public AccountRecord getAccount(String accountId) {
    return accountStore
        .findById(accountId)
        .filter(account -> !account.isDeleted())
        .orElseThrow(() -> IdentityException.notFound("account not found"));
  }

  /**
   * Updates display fields, email and username. Changing the email clears the verified flag and
   * sends a new verification token to the new address.
   */
  public AccountRecord updateProfile(String accountId, ProfileUpdate update) {
    final AccountRecord account = getAccount(accountId);
    final String email =
        update.email() == null ? null : AccountInputPolicy.normalizeEmail(update.email());
    final String username =
        update.username() == null ? null : AccountInputPolicy.normalizeUsername(update.username());
    final boolean emailChanged = email != null && !email.equals(account.email());
    final boolean usernameChanged = username != null && !username.equals(account.username());
    if (emailChanged && accountStore.existsByEmail(email, true)) {
      throw IdentityException.conflict("email is already registered");
    }
    if (usernameChanged && accountStore.existsByUsername(username, true)) {
      throw IdentityException.conflict("username is already taken");
    }

    final SingleUseToken verification =
        emailChanged ? tokenService.issueSingleUse(SingleUseTokenPurpose.EMAIL_VERIFICATION) : null;
    final AccountRecord updated;
    try {
      updated =
          accountStore.save(
              AccountLifecycle.updateProfile(
                  account,
                  email,
                  username,
                  update.profile(),
                  verification == null ? null : verification.slot(),
                  clock.instant()));
    } catch (UniqueConstraintViolationException ex) {
      throw switch (ex.constraint()) {
        case EMAIL -> IdentityException.conflict("email is already registered");
        case USERNAME -> IdentityException.conflict("username is already taken");
        default -> IdentityException.conflict("profile could not be updated");
      };
    } catch (StaleAccountException ex) {
      throw IdentityException.conflict("account was modified concurrently, retry");
    }
    if (verification != null) {
      logger.info("email changed, verification reissued accountId={}", accountId);
      notificationSender.sendEmailVerification(updated, verification);
    }
    return updated;
  }

  /** True if a live account already uses {@code email}. */
  public boolean checkEmailExists(String email) {
    final String folded = AccountInputPolicy.foldEmail(email);
    if (folded == null || folded.isEmpty()) {
      throw IdentityException.validation("email is required");
    }
    return accountStore.existsByEmail(folded, true);
  }

  public boolean checkUsernameExists(String username) {
    if (username == null || username.isBlank()) {
      throw IdentityException.validation("username is required");
    }
    return accountStore.existsByUsername(
        username.trim().toLowerCase(Locale.ROOT), true);
  }

  public AccountPage listAccounts(AccountSearchCriteria criteria) {
    final List<AccountRecord> items = accountStore.search(criteria);
    final long total = accountStore.count(criteria);
    return new AccountPage(items, total, criteria.offset(), criteria.limit());
  }

  public AccountStatistics statistics() {
    return accountStore.statistics();
  }
}
