package com.example.identity.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.identity.config.IdentityCredentialProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CredentialServiceTest {

  private final ExecutorService executor = IdentityFixtures.hashExecutor(2, 8);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void hashNeverEqualsPlaintextAndVerifies() {
    final CredentialService service =
        IdentityFixtures.credentialService(executor, Clock.systemUTC());

    final String digest = service.hash("Secret123");

    assertThat(digest).startsWith("$2a$04$").doesNotContain("Secret123");
    assertThat(service.verify("Secret123", digest)).isTrue();
    assertThat(service.verify("Secret124", digest)).isFalse();
  }

  @Test
  void sameInputProducesDifferentDigests() {
    final CredentialService service =
        IdentityFixtures.credentialService(executor, Clock.systemUTC());

    assertThat(service.hash("Secret123")).isNotEqualTo(service.hash("Secret123"));
  }

  @Test
  void pepperIsRequiredToVerify() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final CredentialService peppered =
        new CredentialService(
            new IdentityCredentialProperties(4, "server-side-pepper", 2, 8),
            executor,
            new IdentityMetrics(registry),
            Clock.systemUTC());
    final CredentialService plain =
        IdentityFixtures.credentialService(executor, Clock.systemUTC());

    final String digest = peppered.hash("Secret123");

    assertThat(peppered.verify("Secret123", digest)).isTrue();
    assertThat(plain.verify("Secret123", digest)).isFalse();
    assertThat(registry.get("identity.credential.hash.duration").timer().count()).isEqualTo(2L);
  }

  @Test
  void malformedDigestIsReportedAsCorrupt() {
    final CredentialService service =
        IdentityFixtures.credentialService(executor, Clock.systemUTC());

    assertThatThrownBy(() -> service.verify("Secret123", "not-a-digest"))
        .isInstanceOf(DigestCorruptException.class);
    assertThatThrownBy(() -> service.verify("Secret123", null))
        .isInstanceOf(DigestCorruptException.class);
  }

  @Test
  void saturatedPoolRejectsWithInfrastructureError() throws Exception {
    final ExecutorService tiny = IdentityFixtures.hashExecutor(1, 1);
    final CountDownLatch release = new CountDownLatch(1);
    try {
      tiny.submit(() -> release.await(5, TimeUnit.SECONDS));
      tiny.submit(() -> release.await(5, TimeUnit.SECONDS));
      final CredentialService service = IdentityFixtures.credentialService(tiny, Clock.systemUTC());

      assertThatThrownBy(() -> service.hash("Secret123"))
          .isInstanceOfSatisfying(
              InfrastructureException.class,
              ex -> {
                assertThat(ex.reason()).isEqualTo(InfrastructureException.Reason.REJECTED);
                assertThat(ex.kind().isRetryable()).isTrue();
              });
    } finally {
      release.countDown();
      tiny.shutdownNow();
    }
  }

  @Test
  void interruptedCallerGetsCancelledAndKeepsInterruptFlag() throws Exception {
    final CredentialService service =
        IdentityFixtures.credentialService(executor, Clock.systemUTC());
    final AtomicReference<Throwable> failure = new AtomicReference<>();
    final AtomicReference<Boolean> stillInterrupted = new AtomicReference<>();

    final Thread caller =
        new Thread(
            () -> {
              Thread.currentThread().interrupt();
              try {
                service.hash("Secret123");
              } catch (Throwable ex) {
                failure.set(ex);
              }
              stillInterrupted.set(Thread.currentThread().isInterrupted());
            });
    caller.start();
    caller.join(5_000);

    assertThat(failure.get())
        .isInstanceOfSatisfying(
            InfrastructureException.class,
            ex -> assertThat(ex.reason()).isEqualTo(InfrastructureException.Reason.CANCELLED));
    assertThat(stillInterrupted.get()).isTrue();
  }
}
