/*
 * どこで: Identity サービス層
 * 何を: 認証操作の結果件数とパスワードハッシュ所要時間を記録する
 * なぜ: ログイン失敗の急増やハッシュプール飽和を Prometheus から観測できるようにするため
 */
package com.example.identity.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class IdentityMetrics {

  private static final String METRIC_AUTH_TOTAL = "identity.auth.total";
  private static final String METRIC_HASH_DURATION = "identity.credential.hash.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> authCounters = new ConcurrentHashMap<>();
  private final Timer hashDurationTimer;

  public IdentityMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.hashDurationTimer =
        Timer.builder(METRIC_HASH_DURATION)
            .description("Time spent computing or verifying password digests")
            .register(meterRegistry);
  }

  /**
   * @param action operation name such as {@code login} or {@code register}
   * @param result {@code success} or the lower-cased {@link ErrorKind}
   */
  public void recordAuthResult(String action, String result) {
    authCounters
        .computeIfAbsent(
            action + '|' + result,
            ignored ->
                Counter.builder(METRIC_AUTH_TOTAL)
                    .description("Identity operation outcomes")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordFailure(String action, IdentityException ex) {
    recordAuthResult(action, ex.kind().name().toLowerCase(Locale.ROOT));
  }

  public void recordHashDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    hashDurationTimer.record(duration);
  }
}
