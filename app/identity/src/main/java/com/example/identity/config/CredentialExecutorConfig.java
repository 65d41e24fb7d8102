/*
 * どこで: app/identity/src/main/java/com/example/identity/config/CredentialExecutorConfig.java
 * 何を: パスワードハッシュ専用の有界ワーカープール
 * なぜ: CPU を占有する bcrypt をリクエストスレッドから切り離し、過負荷時は待たせずに拒否するため
 */
package com.example.identity.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
@EnableConfigurationProperties(IdentityCredentialProperties.class)
public class CredentialExecutorConfig {

  public static final String CREDENTIAL_HASH_EXECUTOR = "credentialHashExecutor";

  @Bean(name = CREDENTIAL_HASH_EXECUTOR, destroyMethod = "shutdown")
  ExecutorService credentialHashExecutor(IdentityCredentialProperties properties) {
    return new ThreadPoolExecutor(
        properties.poolSize(),
        properties.poolSize(),
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(properties.queueCapacity()),
        new CustomizableThreadFactory("credential-hash-"),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
