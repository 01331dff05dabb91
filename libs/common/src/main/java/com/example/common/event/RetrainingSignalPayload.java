/*
 * どこで: common のイベント payload 定義
 * 何を: 再学習トリガーへ送る drift シグナルの形状を定義する
 * なぜ: 推論サービスと再学習ジョブの間で同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RetrainingSignalPayload(
    String eventId,
    String occurredAt,
    String modelVersion,
    String windowStart,
    String windowEnd,
    String statisticName,
    double statistic,
    double threshold,
    int sampleSize,
    String traceId) {}
