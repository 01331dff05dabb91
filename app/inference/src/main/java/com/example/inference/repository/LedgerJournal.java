/*
 * どこで: Inference repository 層
 * 何を: ledger の追記ログ (ジャーナル) への書き込み・再生・書き換えを定義する
 * なぜ: プロセス再起動後も予測と実測の組を復元できるようにするため
 */
package com.example.inference.repository;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

public interface LedgerJournal {

  void append(JournalEntry entry);

  /** 読み取れた行を記録順に consumer へ渡し、読めた行数を返す。 */
  int replay(Consumer<JournalEntry> consumer);

  /**
   * 役割: ジャーナル全体を snapshot の内容で置き換える。
   * 動作: snapshot は追記と排他した状態で取得する。置き換え中の追記は待たされる。
   * 前提: 失敗時は既存ジャーナルを残す。
   */
  void rewrite(Supplier<List<JournalEntry>> snapshot);
}
