/*
 * どこで: Inference artifact 層
 * 何を: 学習ジョブが出力した版付きスコアリング artifact の契約を定義する
 * なぜ: モデル種別に依存せず、schema と score だけを推論経路へ見せるため
 */
package com.example.inference.artifact;

import com.example.inference.model.FeatureSchema;
import com.example.inference.model.FeatureVector;
import com.example.inference.model.Prediction;

public interface ScoringArtifact {

  String modelVersion();

  String modelType();

  FeatureSchema schema();

  /**
   * 役割: 整列済みベクトルから (ラベル, 確率) を求める。
   * 動作: 副作用なし・列数に比例する有界コストで計算する。同じ版と同じベクトルなら常に同じ結果を返す。
   * 前提: vector の長さが schema().width() と一致すること。不一致は内部エラー。
   */
  Prediction score(FeatureVector vector);
}
