/*
 * どこで: app/identity/src/main/java/com/example/identity/service/CredentialService.java
 * 何を: パスワードのハッシュ化と照合
 * なぜ: bcrypt の計算を専用プールへ逃がし、平文を保持・出力しない経路を一箇所に限定するため
 */
package com.example.identity.service;

import com.example.identity.config.CredentialExecutorConfig;
import com.example.identity.config.IdentityCredentialProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Hashes and verifies passwords with bcrypt on the bounded credential pool.
 *
 * <p>Length policy belongs to the caller. This class fails only when a stored digest cannot be
 * parsed ({@link DigestCorruptException}) or when the pool cannot run the work
 * ({@link InfrastructureException}).
 *
 * <p>If the calling thread is interrupted while waiting, the computation is left to finish on the
 * pool and its result is discarded.
 */
@Service
public class CredentialService {

  private static final Logger logger = LoggerFactory.getLogger(CredentialService.class);
  private static final Pattern BCRYPT_DIGEST =
      Pattern.compile("\\A\\$2[aby]?\\$\\d\\d\\$[./0-9A-Za-z]{53}\\z");
  private static final String PEPPER_ALGORITHM = "HmacSHA256";

  private final BCryptPasswordEncoder encoder;
  private final ExecutorService executor;
  private final IdentityMetrics metrics;
  private final Clock clock;
  private final SecretKeySpec pepperKey;
  private final String decoyDigest;

  public CredentialService(
      IdentityCredentialProperties properties,
      @Qualifier(CredentialExecutorConfig.CREDENTIAL_HASH_EXECUTOR) ExecutorService executor,
      IdentityMetrics metrics,
      Clock clock) {
    this.encoder = new BCryptPasswordEncoder(properties.workFactor(), new SecureRandom());
    this.executor = executor;
    this.metrics = metrics;
    this.clock = clock;
    this.pepperKey =
        properties.hasPepper()
            ? new SecretKeySpec(
                properties.pepper().getBytes(StandardCharsets.UTF_8), PEPPER_ALGORITHM)
            : null;
    this.decoyDigest = encoder.encode(UUID.randomUUID().toString());
  }

  public String hash(String plaintext) {
    return runOnPool("hash", () -> encoder.encode(pepper(plaintext)));
  }

  /** Returns false on mismatch; never throws for a wrong password. */
  public boolean verify(String plaintext, String digest) {
    if (digest == null || !BCRYPT_DIGEST.matcher(digest).matches()) {
      throw new DigestCorruptException("stored password digest is not a bcrypt digest");
    }
    return runOnPool("verify", () -> encoder.matches(pepper(plaintext), digest));
  }

  /**
   * Runs one verification against a digest no password matches, so a login for an unknown email
   * costs the same as a mismatch.
   */
  public void verifyDecoy(String plaintext) {
    runOnPool("verify", () -> encoder.matches(pepper(plaintext), decoyDigest));
  }

  private <T> T runOnPool(String operation, Callable<T> work) {
    if (Thread.currentThread().isInterrupted()) {
      throw new InfrastructureException(
          InfrastructureException.Reason.CANCELLED, "credential " + operation + " cancelled");
    }
    final Future<T> future;
    try {
      future = executor.submit(() -> timed(work));
    } catch (RejectedExecutionException ex) {
      logger.warn("credential pool saturated, rejecting {}", operation);
      throw new InfrastructureException(
          InfrastructureException.Reason.REJECTED, "credential pool is saturated", ex);
    }
    try {
      return future.get();
    } catch (InterruptedException ex) {
      // 計算途中では中断しない。結果は破棄する
      Thread.currentThread().interrupt();
      throw new InfrastructureException(
          InfrastructureException.Reason.CANCELLED, "credential " + operation + " cancelled", ex);
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("credential " + operation + " failed", cause);
    }
  }

  private <T> T timed(Callable<T> work) throws Exception {
    final Instant startedAt = clock.instant();
    try {
      return work.call();
    } finally {
      metrics.recordHashDuration(Duration.between(startedAt, clock.instant()));
    }
  }

  private String pepper(String plaintext) {
    if (pepperKey == null) {
      return plaintext;
    }
    try {
      final Mac mac = Mac.getInstance(PEPPER_ALGORITHM);
      mac.init(pepperKey);
      return Base64.getEncoder()
          .encodeToString(mac.doFinal(plaintext.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("pepper HMAC unavailable", ex);
    }
  }
}
