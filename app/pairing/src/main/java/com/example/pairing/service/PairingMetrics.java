/*
 * どこで: Pairing サービス層
 * 何を: セッション作成/評価提出/結果計算のメトリクス記録を集約する
 * なぜ: 提出の進み具合と計算コストを運用で継続監視できるようにするため
 */
package com.example.pairing.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class PairingMetrics {

  private static final String METRIC_SESSION_CREATED = "pairing.session.created.total";
  private static final String METRIC_SUBMISSION_TOTAL = "pairing.submission.total";
  private static final String METRIC_SUBMISSION_DROPPED = "pairing.submission.dropped_entries";
  private static final String METRIC_RESULTS_TOTAL = "pairing.results.total";
  private static final String METRIC_COMPUTE_DURATION = "pairing.compute.duration";

  private final MeterRegistry meterRegistry;
  private final Counter droppedEntries;
  private final ConcurrentMap<String, Counter> sessionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> submissionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> resultCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> computeTimers = new ConcurrentHashMap<>();

  public PairingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.droppedEntries =
        Counter.builder(METRIC_SUBMISSION_DROPPED)
            .description("Rating entries dropped for self-rating or out-of-range score")
            .register(meterRegistry);
  }

  public void recordSessionCreated(String mode) {
    sessionCounters
        .computeIfAbsent(
            mode,
            key ->
                Counter.builder(METRIC_SESSION_CREATED)
                    .description("Pairing sessions created")
                    .tags(Tags.of("mode", key))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSubmission(String result, int dropped) {
    submissionCounters
        .computeIfAbsent(
            result,
            key ->
                Counter.builder(METRIC_SUBMISSION_TOTAL)
                    .description("Rating submissions")
                    .tags(Tags.of("result", key))
                    .register(meterRegistry))
        .increment();
    if (dropped > 0) {
      droppedEntries.increment(dropped);
    }
  }

  public void recordResults(String result) {
    resultCounters
        .computeIfAbsent(
            result,
            key ->
                Counter.builder(METRIC_RESULTS_TOTAL)
                    .description("Pairing result requests")
                    .tags(Tags.of("result", key))
                    .register(meterRegistry))
        .increment();
  }

  public <T> T recordCompute(String algorithm, Supplier<T> computation) {
    final Timer timer =
        computeTimers.computeIfAbsent(
            algorithm,
            key ->
                Timer.builder(METRIC_COMPUTE_DURATION)
                    .description("Pairing engine computation time")
                    .tags(Tags.of("algorithm", key))
                    .register(meterRegistry));
    return timer.record(computation);
  }
}
