package com.example.identity.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;

/** 同じ email / 外部 ID への同時要求が一件の作成へ収束することを確認する。 */
class AuthenticationConcurrencyTest {

  private static final int CALLERS = 8;

  private final ExecutorService hashExecutor = IdentityFixtures.hashExecutor(4, 64);
  private final ExecutorService callers = Executors.newFixedThreadPool(CALLERS);
  private InMemoryAccountStore store;
  private AuthenticationService service;

  @BeforeEach
  void setUp() {
    final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    store = new InMemoryAccountStore();
    service =
        new AuthenticationService(
            store,
            IdentityFixtures.credentialService(hashExecutor, clock),
            new TokenService(IdentityFixtures.tokenProperties(), store, clock),
            new RecordingNotificationSender(),
            IdentityFixtures.metrics(),
            clock);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    callers.shutdownNow();
    hashExecutor.shutdownNow();
    callers.awaitTermination(5, TimeUnit.SECONDS);
  }

  @RepeatedTest(3)
  void concurrentRegistrationWithSameEmailCreatesOneAccount() throws Exception {
    final List<Outcome<RegistrationResult>> outcomes =
        race(
            index ->
                () ->
                    service.register(
                        new RegisterCommand(
                            "Same@x.com", "user" + index, "Secret123", null, null, null)));

    assertThat(outcomes).filteredOn(Outcome::succeeded).hasSize(1);
    assertThat(outcomes)
        .filteredOn(outcome -> !outcome.succeeded())
        .allSatisfy(outcome -> assertThat(outcome.kind()).isEqualTo(ErrorKind.CONFLICT));
    assertThat(store.countMatching(account -> account.email().equals("same@x.com"))).isEqualTo(1);
  }

  @RepeatedTest(3)
  void concurrentExternalLoginCreatesExactlyOneAccount() throws Exception {
    final List<Outcome<ExternalLoginResult>> outcomes =
        race(
            index ->
                () ->
                    service.externalLogin(
                        new ExternalLoginCommand(
                            "google", "sub-42", "new@x.com", null, null, "10.0.0." + index)));

    assertThat(outcomes).allSatisfy(outcome -> assertThat(outcome.succeeded()).isTrue());
    assertThat(outcomes).filteredOn(outcome -> outcome.value().newAccount()).hasSize(1);
    assertThat(outcomes.stream().map(outcome -> outcome.value().auth().accountId()).distinct())
        .hasSize(1);
    assertThat(
            store.countMatching(
                account ->
                    account.externalIdentity() != null
                        && account.externalIdentity().providerId().equals("sub-42")))
        .isEqualTo(1);
  }

  private <T> List<Outcome<T>> race(IndexedTask<T> task) throws Exception {
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<T>> futures = new ArrayList<>();
    for (int i = 0; i < CALLERS; i++) {
      final Callable<T> body = task.create(i);
      futures.add(
          callers.submit(
              () -> {
                start.await();
                return body.call();
              }));
    }
    start.countDown();
    final List<Outcome<T>> outcomes = new ArrayList<>();
    for (Future<T> future : futures) {
      try {
        outcomes.add(new Outcome<>(future.get(30, TimeUnit.SECONDS), null));
      } catch (ExecutionException ex) {
        if (!(ex.getCause() instanceof IdentityException identityException)) {
          throw ex;
        }
        outcomes.add(new Outcome<>(null, identityException.kind()));
      }
    }
    return outcomes;
  }

  @FunctionalInterface
  private interface IndexedTask<T> {
    Callable<T> create(int index);
  }

  private record Outcome<T>(T value, ErrorKind kind) {
    boolean succeeded() {
      return kind == null;
    }
  }
}
