/*
 * どこで: Inference drift 監視
 * 何を: 外部の再学習トリガーへ drift シグナルを送る口を定義する
 * なぜ: 送信手段 (NATS/ログのみ) を監視ロジックから切り離すため
 */
package com.example.inference.service;

import com.example.inference.model.DriftVerdict;

public interface RetrainingTrigger {

  /**
   * 役割: 閾値超過の判定結果を再学習トリガーへ送る。
   * 前提: 送信できなかった場合は RetrainingSignalException を投げる。再学習するかどうかは受け手が決める。
   */
  void signal(DriftVerdict verdict, String modelVersion);
}
