/*
 * どこで: Inference API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因 (検証/整列/artifact) を区別できるようにするため
 */
package com.example.inference.api;

public enum ApiErrorCode {
  VALIDATION_ERROR,
  MISSING_FEATURE,
  UNKNOWN_CATEGORY,
  INVALID_FEATURE_TYPE,
  ARTIFACT_UNAVAILABLE,
  ARTIFACT_LOAD_FAILED,
  OUTCOME_CONFLICT,
  DRIFT_EVALUATION_RUNNING,
  NOT_FOUND,
  INTERNAL_ERROR
}
