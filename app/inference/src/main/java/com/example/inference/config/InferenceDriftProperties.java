/*
 * どこで: Inference アプリの設定バインド
 * 何を: drift 判定の窓・閾値・最小標本数・cooldown・統計量を保持する
 * なぜ: 判定プロトコルのパラメータを起動時に検証し、環境ごとに調整するため
 */
package com.example.inference.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inference.drift")
@Validated
public record InferenceDriftProperties(
    boolean enabled,
    @NotNull Duration evaluationInterval,
    @NotNull Duration window,
    @NotNull Duration outcomeWindow,
    @Positive int minSampleSize,
    double threshold,
    @NotNull Duration cooldown,
    @NotBlank String statistic) {

  @AssertTrue(message = "inference.drift.window must be positive")
  public boolean isWindowPositive() {
    return isPositiveDuration(window);
  }

  @AssertTrue(message = "inference.drift.evaluation-interval must be positive")
  public boolean isEvaluationIntervalPositive() {
    return isPositiveDuration(evaluationInterval);
  }

  @AssertTrue(message = "inference.drift.outcome-window must be positive")
  public boolean isOutcomeWindowPositive() {
    return isPositiveDuration(outcomeWindow);
  }

  @AssertTrue(message = "inference.drift.cooldown must not be negative")
  public boolean isCooldownNotNegative() {
    return cooldown != null && !cooldown.isNegative();
  }

  @AssertTrue(message = "inference.drift.threshold must be a finite non-negative number")
  public boolean isThresholdValid() {
    return Double.isFinite(threshold) && threshold >= 0.0;
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
