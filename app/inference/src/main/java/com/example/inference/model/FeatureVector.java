/*
 * どこで: Inference ドメインモデル
 * 何を: artifact へ渡す固定長の数値ベクトルを保持する
 * なぜ: 生成後に書き換えられない入力として scorer へ渡すため
 */
package com.example.inference.model;

import java.util.Arrays;

public final class FeatureVector {

  private final double[] values;

  public FeatureVector(double[] values) {
    this.values = values.clone();
  }

  public int length() {
    return values.length;
  }

  public double get(int index) {
    return values[index];
  }

  public double[] toArray() {
    return values.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof FeatureVector vector && Arrays.equals(values, vector.values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "FeatureVector" + Arrays.toString(values);
  }
}
