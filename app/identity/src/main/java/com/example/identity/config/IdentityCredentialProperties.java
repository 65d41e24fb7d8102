package com.example.identity.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * パスワードハッシュ設定。
 *
 * @param workFactor bcrypt strength (log2 rounds)
 * @param pepper optional secret mixed into every password before hashing; blank disables it
 * @param poolSize hashing worker threads
 * @param queueCapacity hashing requests allowed to wait before new ones are rejected
 */
@Validated
@ConfigurationProperties(prefix = "identity.credential")
public record IdentityCredentialProperties(
    @Min(4) @Max(31) Integer workFactor,
    String pepper,
    @Min(1) Integer poolSize,
    @Min(1) Integer queueCapacity) {

  public IdentityCredentialProperties {
    workFactor = workFactor == null ? 12 : workFactor;
    pepper = pepper == null ? "" : pepper;
    poolSize =
        poolSize == null ? Math.max(2, Runtime.getRuntime().availableProcessors()) : poolSize;
    queueCapacity = queueCapacity == null ? 256 : queueCapacity;
  }

  public boolean hasPepper() {
    return !pepper.isBlank();
  }
}
