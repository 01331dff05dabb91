/*
 * どこで: Inference アプリの設定バインド
 * 何を: outcome ledger の journal と書き込みスレッドの設定を保持する
 * なぜ: 永続化の有無と書き込みキューの上限を環境ごとに調整するため
 */
package com.example.inference.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "inference.ledger")
@Validated
public record InferenceLedgerProperties(
    @DefaultValue("true") boolean journalEnabled,
    @DefaultValue("data/ledger.jsonl") String journalPath,
    @Positive int writerThreads,
    @Positive int writerQueueCapacity) {

  @AssertTrue(message = "inference.ledger.journal-path is required when the journal is enabled")
  public boolean isJournalPathPresentWhenEnabled() {
    return !journalEnabled || (journalPath != null && !journalPath.isBlank());
  }
}
