/*
 * どこで: Inference アプリの設定バインド
 * 何を: メトリクス名の厳格チェックと latency ヒストグラムのバケット境界を保持する
 * なぜ: 開発時は未定義メトリクスを即失敗させ、本番ではログのみに留めるため
 */
package com.example.inference.config;

import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inference.telemetry")
@Validated
public record InferenceTelemetryProperties(
    boolean strictMetricNames, @NotEmpty List<Duration> latencyBuckets) {

  public InferenceTelemetryProperties {
    latencyBuckets = latencyBuckets == null ? List.of() : List.copyOf(latencyBuckets);
  }
}
