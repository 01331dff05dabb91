/*
 * どこで: Inference drift 監視
 * 何を: NATS 無効時に再学習シグナルをログへ出す
 * なぜ: ローカル実行やテストでもシグナル発火を観測できるようにするため
 */
package com.example.inference.service;

import com.example.inference.model.DriftVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingRetrainingTrigger implements RetrainingTrigger {

  private static final Logger logger = LoggerFactory.getLogger(LoggingRetrainingTrigger.class);

  @Override
  public void signal(DriftVerdict verdict, String modelVersion) {
    logger.warn(
        "retraining signal raised modelVersion={} statistic={} value={} threshold={}"
            + " sampleSize={} windowStart={} windowEnd={}",
        modelVersion,
        verdict.statisticName(),
        verdict.statistic(),
        verdict.threshold(),
        verdict.sampleSize(),
        verdict.windowStart(),
        verdict.windowEnd());
  }
}
