/*
 * どこで: home-view サービス層
 * 何を: page_params 構築結果と下流呼び出しのメトリクスを記録する
 * なぜ: spectator / 認証済みごとの成功率と event queue 遅延を Prometheus から観測するため
 */
package com.example.home_view.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class HomeViewMetrics {

  private static final String METRIC_PAGE_PARAMS_TOTAL = "home.page_params.total";
  private static final String METRIC_DEPENDENCY_ERROR_TOTAL =
      "home.page_params.dependency.error.total";
  private static final String METRIC_DEPENDENCY_DURATION = "home.page_params.dependency.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> pageParamsCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> dependencyTimers = new ConcurrentHashMap<>();

  public HomeViewMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordPageParamsResult(String session, String result) {
    final String key = session + "|" + result;
    pageParamsCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_PAGE_PARAMS_TOTAL)
                    .description("Home view page params build outcomes")
                    .tags(Tags.of("session", session, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDependencyError(String dependency, String reason) {
    final String key = dependency + "|" + reason;
    dependencyErrorCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_DEPENDENCY_ERROR_TOTAL)
                    .description("Home view page params dependency errors")
                    .tags(Tags.of("dependency", dependency, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDependencyDuration(String dependency, String result, Duration duration) {
    final String key = dependency + "|" + result;
    dependencyTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_DEPENDENCY_DURATION)
                    .description("Home view page params dependency call duration")
                    .tags(Tags.of("dependency", dependency, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }
}
