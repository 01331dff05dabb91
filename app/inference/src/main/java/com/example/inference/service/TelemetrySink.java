/*
 * どこで: Inference サービス層
 * 何を: 名前で引くカウンタ/latency ヒストグラムを保持し、スナップショットをテキストで描画する
 * なぜ: 明示的に生成した単一インスタンスを endpoint と monitor へ渡し、静的なグローバル状態を持たないため
 */
package com.example.inference.service;

import com.example.inference.config.InferenceTelemetryProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class TelemetrySink {

  private static final Logger logger = LoggerFactory.getLogger(TelemetrySink.class);

  public static final String CONTENT_TYPE_PROMETHEUS = "text/plain; version=0.0.4; charset=utf-8";
  public static final String CONTENT_TYPE_OPENMETRICS =
      "application/openmetrics-text; version=1.0.0; charset=utf-8";

  static final String METRIC_UNKNOWN_TOTAL = "inference.telemetry.unknown_metric.total";

  public enum MetricKind {
    COUNTER,
    HISTOGRAM
  }

  public record RenderedMetrics(String contentType, String body) {}

  private record MeterKey(String name, Tags tags) {}

  private final MeterRegistry meterRegistry;
  private final boolean strictMetricNames;
  private final Duration[] latencyBuckets;
  private final ConcurrentMap<String, MetricKind> declaredKinds = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, String> descriptions = new ConcurrentHashMap<>();
  private final ConcurrentMap<MeterKey, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<MeterKey, Timer> timers = new ConcurrentHashMap<>();
  private final Set<String> reportedUnknownNames = ConcurrentHashMap.newKeySet();
  private final Counter unknownMetricCounter;

  public TelemetrySink(MeterRegistry meterRegistry, InferenceTelemetryProperties properties) {
    this.meterRegistry = meterRegistry;
    this.strictMetricNames = properties.strictMetricNames();
    this.latencyBuckets =
        properties.latencyBuckets().stream().sorted().distinct().toArray(Duration[]::new);
    this.unknownMetricCounter =
        Counter.builder(METRIC_UNKNOWN_TOTAL)
            .description("Metric writes rejected because the name was never declared")
            .register(meterRegistry);
  }

  public void declareCounter(String name, String description) {
    declare(name, MetricKind.COUNTER, description);
  }

  public void declareHistogram(String name, String description) {
    declare(name, MetricKind.HISTOGRAM, description);
  }

  /**
   * 役割: 宣言済みカウンタを 1 増やす。
   * 動作: タグの組ごとに Counter を遅延登録する。未宣言名は strict 時に例外、それ以外はログと計数のみ。
   * 前提: tags はキーと値を交互に並べた偶数個の文字列であること。
   */
  public void increment(String name, String... tags) {
    incrementBy(name, 1.0, tags);
  }

  public void incrementBy(String name, double amount, String... tags) {
    if (!isDeclaredAs(name, MetricKind.COUNTER)) {
      return;
    }
    counters
        .computeIfAbsent(
            new MeterKey(name, Tags.of(tags)),
            key ->
                Counter.builder(key.name())
                    .description(descriptions.get(key.name()))
                    .tags(key.tags())
                    .register(meterRegistry))
        .increment(amount);
  }

  /**
   * 役割: 宣言済みヒストグラムへ経過時間を 1 件記録する。
   * 動作: 設定されたバケット境界 (SLO) を持つ Timer をタグの組ごとに遅延登録する。
   * 前提: duration は負でないこと。負値は 0 として扱う。
   */
  public void observe(String name, Duration duration, String... tags) {
    if (!isDeclaredAs(name, MetricKind.HISTOGRAM)) {
      return;
    }
    final Duration observed = duration.isNegative() ? Duration.ZERO : duration;
    timers.computeIfAbsent(new MeterKey(name, Tags.of(tags)), this::registerTimer).record(observed);
  }

  public <T> void gauge(String name, String description, T state, ToDoubleFunction<T> valueFunction) {
    Gauge.builder(name, state, valueFunction).description(description).register(meterRegistry);
  }

  /**
   * 役割: 現在のメトリクスをテキストで描画する。
   * 動作: Accept に OpenMetrics が含まれれば OpenMetrics、それ以外は Prometheus テキスト形式を返す。
   *       Prometheus レジストリが無い構成 (テストなど) では計測値を同形式の行へ直接書き出す。
   * 前提: なし。書き込み側はメーター単位の短い区間以外で待たされない。
   */
  public RenderedMetrics render(String acceptHeader) {
    final String contentType = negotiateContentType(acceptHeader);
    final Optional<PrometheusMeterRegistry> prometheus = findPrometheusRegistry();
    if (prometheus.isPresent()) {
      return new RenderedMetrics(contentType, prometheus.get().scrape(contentType));
    }
    return new RenderedMetrics(CONTENT_TYPE_PROMETHEUS, renderPlain());
  }

  private void declare(String name, MetricKind kind, String description) {
    final MetricKind existing = declaredKinds.putIfAbsent(name, kind);
    if (existing != null && existing != kind) {
      throw new IllegalStateException(
          "metric " + name + " is already declared as " + existing + ", not " + kind);
    }
    descriptions.putIfAbsent(name, description);
  }

  private boolean isDeclaredAs(String name, MetricKind kind) {
    if (kind == declaredKinds.get(name)) {
      return true;
    }
    if (strictMetricNames) {
      throw new UnknownMetricException(name);
    }
    unknownMetricCounter.increment();
    if (reportedUnknownNames.add(name)) {
      logger.warn("metric write ignored because the name is not declared name={} kind={}", name, kind);
    }
    return false;
  }

  private Timer registerTimer(MeterKey key) {
    final Timer.Builder builder =
        Timer.builder(key.name()).description(descriptions.get(key.name())).tags(key.tags());
    if (latencyBuckets.length > 0) {
      builder
          .serviceLevelObjectives(latencyBuckets)
          .minimumExpectedValue(latencyBuckets[0])
          .maximumExpectedValue(latencyBuckets[latencyBuckets.length - 1]);
    }
    return builder.register(meterRegistry);
  }

  private String negotiateContentType(String acceptHeader) {
    if (acceptHeader != null
        && acceptHeader.toLowerCase(Locale.ROOT).contains("application/openmetrics-text")) {
      return CONTENT_TYPE_OPENMETRICS;
    }
    return CONTENT_TYPE_PROMETHEUS;
  }

  private Optional<PrometheusMeterRegistry> findPrometheusRegistry() {
    if (meterRegistry instanceof PrometheusMeterRegistry prometheusMeterRegistry) {
      return Optional.of(prometheusMeterRegistry);
    }
    if (meterRegistry instanceof CompositeMeterRegistry composite) {
      return composite.getRegistries().stream()
          .filter(PrometheusMeterRegistry.class::isInstance)
          .map(PrometheusMeterRegistry.class::cast)
          .findFirst();
    }
    return Optional.empty();
  }

  private String renderPlain() {
    final StringBuilder builder = new StringBuilder();
    final List<Meter> meters =
        meterRegistry.getMeters().stream()
            .sorted(Comparator.comparing(meter -> meter.getId().getName()))
            .toList();
    for (Meter meter : meters) {
      final String baseName = sanitize(meter.getId().getName());
      final String labels = renderLabels(meter.getId().getTags());
      for (Measurement measurement : meter.measure()) {
        builder
            .append(baseName)
            .append('_')
            .append(measurement.getStatistic().name().toLowerCase(Locale.ROOT))
            .append(labels)
            .append(' ')
            .append(measurement.getValue())
            .append('\n');
      }
    }
    return builder.toString();
  }

  private String renderLabels(List<Tag> tags) {
    if (tags.isEmpty()) {
      return "";
    }
    final StringBuilder builder = new StringBuilder("{");
    for (int i = 0; i < tags.size(); i++) {
      if (i > 0) {
        builder.append(',');
      }
      final Tag tag = tags.get(i);
      builder
          .append(sanitize(tag.getKey()))
          .append("=\"")
          .append(tag.getValue().replace("\\", "\\\\").replace("\"", "\\\""))
          .append('"');
    }
    return builder.append('}').toString();
  }

  private String sanitize(String name) {
    return name.replaceAll("[^a-zA-Z0-9_:]", "_");
  }
}
