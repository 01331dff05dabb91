/*
 * どこで: Inference ドメインモデル
 * 何を: 提供した予測 1 件の監査用記録を定義する
 * なぜ: outcome と request id で突き合わせ、drift 判定に使うため
 */
package com.example.inference.model;

import java.time.Instant;

public record PredictionRecord(
    String requestId,
    Instant predictedAt,
    String inputHash,
    int label,
    double probability,
    String modelVersion) {}
