/*
 * どこで: Inference アプリの設定バインド
 * 何を: スコアリング artifact の配置場所と再読込設定を保持する
 * なぜ: 学習ジョブが出力した artifact の差し替えを運用で制御するため
 */
package com.example.inference.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inference.artifact")
@Validated
public record InferenceArtifactProperties(
    @NotBlank String location,
    boolean failFast,
    boolean reloadEnabled,
    @NotNull Duration reloadInterval) {

  @AssertTrue(message = "inference.artifact.reload-interval must be positive")
  public boolean isReloadIntervalPositive() {
    return reloadInterval != null && !reloadInterval.isZero() && !reloadInterval.isNegative();
  }
}
