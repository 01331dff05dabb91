package com.example.inference.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.example.inference.model.LedgerPair;
import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.PredictionRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DriftStatisticTest {

  private static final Instant AT = Instant.parse("2026-03-01T00:00:00Z");

  private final PositiveRateGapStatistic positiveRateGap = new PositiveRateGapStatistic();
  private final BrierScoreStatistic brierScore = new BrierScoreStatistic();

  @Test
  void positiveRateGapIsAbsoluteDifferenceOfRates() {
    // 予測陽性 3/4、実測陽性 1/4
    final List<LedgerPair> samples =
        List.of(
            pair("a", 1, 0.9, 1),
            pair("b", 1, 0.8, 0),
            pair("c", 1, 0.7, 0),
            pair("d", 0, 0.1, 0));

    assertThat(positiveRateGap.compute(samples)).isCloseTo(0.5, within(1e-12));
  }

  @Test
  void positiveRateGapIsZeroWhenRatesMatch() {
    final List<LedgerPair> samples = List.of(pair("a", 1, 0.9, 0), pair("b", 0, 0.2, 1));

    assertThat(positiveRateGap.compute(samples)).isZero();
  }

  @Test
  void brierScoreIsMeanSquaredProbabilityError() {
    final List<LedgerPair> samples = List.of(pair("a", 1, 0.9, 1), pair("b", 1, 0.6, 0));

    // (0.01 + 0.36) / 2
    assertThat(brierScore.compute(samples)).isCloseTo(0.185, within(1e-12));
  }

  @Test
  void emptySamplesAreRejected() {
    assertThatThrownBy(() -> positiveRateGap.compute(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> brierScore.compute(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void namesMatchConfigurationValues() {
    assertThat(positiveRateGap.name()).isEqualTo("positive-rate-gap");
    assertThat(brierScore.name()).isEqualTo("brier-score");
  }

  private static LedgerPair pair(String requestId, int label, double probability, int realized) {
    return new LedgerPair(
        new PredictionRecord(requestId, AT, "hash", label, probability, "v1"),
        new OutcomeUpdate(requestId, realized, AT.plusSeconds(60)));
  }
}
