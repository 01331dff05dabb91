package com.example.inference.model;

import java.util.Locale;

public enum OutcomeUpsertResult {
  /** 予測記録と結合した。 */
  JOINED,
  /** 予測記録がまだ無いため保留した。予測の追記時に結合する。 */
  ORPHANED,
  /** 同じ内容の再配信で、何も変えていない。 */
  DUPLICATE,
  /** 既存と異なるラベルの再配信で、既存を保持した。 */
  CONFLICT;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
