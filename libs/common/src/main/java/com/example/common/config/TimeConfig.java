/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として公開する
 * なぜ: トークン期限やログイン時刻を同じ時計で決め、テストで固定時刻を差し込めるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
