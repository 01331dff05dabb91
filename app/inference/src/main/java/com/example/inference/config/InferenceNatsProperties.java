/*
 * どこで: Inference アプリの設定バインド
 * 何を: 再学習シグナル publish と outcome 購読の JetStream 設定を保持する
 * なぜ: subject/stream/durable と再配信制御の窓を環境で調整し、起動時に妥当性を検証するため
 */
package com.example.inference.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inference.nats")
@Validated
public record InferenceNatsProperties(
    @NotBlank String retrainingSubject,
    @NotBlank String outcomeSubject,
    @NotBlank String outcomeStream,
    @NotBlank String outcomeDurable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "inference.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "inference.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    // ack-wait は再配信猶予なので 0 以下は許容しない。
    return isPositiveDuration(ackWait);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
