package com.example.inference.service;

/** 宣言されていない名前でメトリクスを記録しようとした内部プログラミングエラー。 */
public class UnknownMetricException extends IllegalStateException {
  public UnknownMetricException(String metricName) {
    super("metric is not declared: " + metricName);
  }
}
