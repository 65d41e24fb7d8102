/*
 * どこで: identity のログ設定テスト
 * 何を: JSON エンコーダと MDC キー(trace/span と運用キー)の出力定義を検証する
 * なぜ: 設定変更で構造化ログやトレース連携が欠落する回帰を防ぐため
 */
package com.example.identity;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class LoggingConfigurationTest {

  @Test
  void logbackConfigurationContainsJsonEncoderAndTraceFields() throws IOException {
    final ClassPathResource resource = new ClassPathResource("logback-spring.xml");
    assertThat(resource.exists()).isTrue();

    final String configText =
        new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

    assertThat(configText).contains("net.logstash.logback.encoder.LoggingEventCompositeJsonEncoder");
    assertThat(configText).contains("<includeMdcKeyName>trace_id</includeMdcKeyName>");
    assertThat(configText).contains("<includeMdcKeyName>span_id</includeMdcKeyName>");
  }

  @Test
  void logbackConfigurationExposesRequestKeys() throws IOException {
    final String configText =
        new String(
            new ClassPathResource("logback-spring.xml").getInputStream().readAllBytes(),
            StandardCharsets.UTF_8);

    assertThat(configText)
        .contains("<includeMdcKeyName>request_id</includeMdcKeyName>")
        .contains("<includeMdcKeyName>client_ip</includeMdcKeyName>")
        .contains("<includeMdcKeyName>account_id</includeMdcKeyName>");
  }
}
