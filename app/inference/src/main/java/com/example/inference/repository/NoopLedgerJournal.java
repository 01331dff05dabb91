/*
 * どこで: Inference repository 層
 * 何を: ジャーナル無効時のダミー実装を提供する
 * なぜ: テストや使い捨て環境で、明示的に無効化したときだけファイルを作らずに ledger を動かすため
 */
package com.example.inference.repository;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "inference.ledger.journal-enabled", havingValue = "false")
public class NoopLedgerJournal implements LedgerJournal {

  @Override
  public void append(JournalEntry entry) {
    // no-op
  }

  @Override
  public int replay(Consumer<JournalEntry> consumer) {
    return 0;
  }

  @Override
  public void rewrite(Supplier<List<JournalEntry>> snapshot) {
    // no-op
  }
}
