/*
 * どこで: Inference アプリの設定バインド
 * 何を: ledger の保持期間と compaction 間隔を保持する
 * なぜ: 古い予測/実測の組を定期的に落とし、メモリと journal の肥大化を防ぐため
 */
package com.example.inference.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inference.ledger.retention")
@Validated
public record InferenceLedgerRetentionProperties(
    boolean enabled, @NotNull Duration horizon, Duration cleanupInterval) {}
