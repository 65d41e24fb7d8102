package com.example.identity.service;

import static com.example.identity.service.TokenServiceTest.assertKind;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.identity.model.AccountProfile;
import com.example.identity.model.AccountRecord;
import com.example.identity.model.AccountRole;
import com.example.identity.model.AccountSearchCriteria;
import com.example.identity.model.AccountStatus;
import com.example.identity.model.ExternalIdentity;
import com.example.identity.model.LifecycleEvent;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountServiceTest {

  private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

  private MutableClock clock;
  private InMemoryAccountStore store;
  private RecordingNotificationSender sender;
  private AccountService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemoryAccountStore();
    sender = new RecordingNotificationSender();
    service =
        new AccountService(
            store,
            new TokenService(IdentityFixtures.tokenProperties(), store, clock),
            sender,
            clock);
  }

  private AccountRecord account(String id, String email, String username) {
    final AccountRecord created =
        store.save(
            AccountLifecycle.newExternalAccount(
                id, email, username, new ExternalIdentity("google", id), null, clock.instant()));
    clock.advance(Duration.ofSeconds(1));
    return created;
  }

  @Test
  void getAccountHidesSoftDeletedAccounts() {
    final AccountRecord created = account("acc-1", "a@x.com", "alice");
    store.save(AccountLifecycle.apply(created, LifecycleEvent.SOFT_DELETE, START));

    assertKind(() -> service.getAccount("acc-1"), ErrorKind.NOT_FOUND);
    assertKind(() -> service.getAccount("missing"), ErrorKind.NOT_FOUND);
  }

  @Test
  void updateProfileMergesDisplayFields() {
    account("acc-1", "a@x.com", "alice");

    service.updateProfile(
        "acc-1",
        new ProfileUpdate(null, null, new AccountProfile("Alice", null, null, null, null, null)));
    final AccountRecord updated =
        service.updateProfile(
            "acc-1",
            new ProfileUpdate(null, "Alice2", new AccountProfile(null, "Liddell", null, null, null, null)));

    assertThat(updated.username()).isEqualTo("alice2");
    assertThat(updated.profile().firstName()).isEqualTo("Alice");
    assertThat(updated.profile().lastName()).isEqualTo("Liddell");
    assertThat(updated.emailVerified()).isTrue();
    assertThat(sender.lastVerificationToken("acc-1")).isNull();
  }

  @Test
  void changingEmailRequiresReverification() {
    account("acc-1", "a@x.com", "alice");

    final AccountRecord updated =
        service.updateProfile("acc-1", new ProfileUpdate("New@X.com", null, null));

    assertThat(updated.email()).isEqualTo("new@x.com");
    assertThat(updated.emailVerified()).isFalse();
    assertThat(updated.status()).isEqualTo(AccountStatus.ACTIVE);
    assertThat(updated.verificationToken()).isNotNull();
    assertThat(sender.lastVerificationToken("acc-1")).isNotNull();
  }

  @Test
  void updateProfileRejectsTakenEmailAndUsername() {
    account("acc-1", "a@x.com", "alice");
    account("acc-2", "b@x.com", "bob");

    assertKind(
        () -> service.updateProfile("acc-1", new ProfileUpdate("B@x.com", null, null)),
        ErrorKind.CONFLICT);
    assertKind(
        () -> service.updateProfile("acc-1", new ProfileUpdate(null, "BOB", null)),
        ErrorKind.CONFLICT);
    assertKind(
        () -> service.updateProfile("acc-1", new ProfileUpdate("broken", null, null)),
        ErrorKind.VALIDATION);
  }

  @Test
  void existenceChecksIgnoreCaseAndDeletedAccounts() {
    final AccountRecord created = account("acc-1", "a@x.com", "alice");

    assertThat(service.checkEmailExists(" A@X.COM ")).isTrue();
    assertThat(service.checkUsernameExists("ALICE")).isTrue();
    assertThat(service.checkEmailExists("other@x.com")).isFalse();

    store.save(AccountLifecycle.apply(created, LifecycleEvent.SOFT_DELETE, START));
    assertThat(service.checkEmailExists("a@x.com")).isFalse();
    assertThat(service.checkUsernameExists("alice")).isFalse();
    assertKind(() -> service.checkUsernameExists(" "), ErrorKind.VALIDATION);
  }

  @Test
  void listAccountsFiltersAndPages() {
    account("acc-1", "a@x.com", "alice");
    account("acc-2", "b@x.com", "bob");
    final AccountRecord carol = account("acc-3", "c@x.com", "carol");
    store.save(AccountLifecycle.changeRole(carol, AccountRole.ADMIN, START));

    final AccountPage page =
        service.listAccounts(new AccountSearchCriteria(null, null, null, null, null, null, 1, 1));
    assertThat(page.total()).isEqualTo(3);
    assertThat(page.items()).extracting(AccountRecord::id).containsExactly("acc-2");

    final AccountPage admins =
        service.listAccounts(
            new AccountSearchCriteria(null, AccountRole.ADMIN, null, null, null, null, 0, 0));
    assertThat(admins.items()).extracting(AccountRecord::id).containsExactly("acc-3");
    assertThat(admins.limit()).isEqualTo(100);

    assertThat(service.statistics().admins()).isEqualTo(1);
  }
}
