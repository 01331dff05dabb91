/*
 * どこで: Inference サービス層
 * 何を: 入力レコードを schema へ整列できなかったことを表現する
 * なぜ: 欠損/未知カテゴリ/型不一致をクライアント起因エラーとして型付きで返すため
 */
package com.example.inference.service;

public class FeatureAlignmentException extends RuntimeException {

  private final AlignmentFailure failure;
  private final String fieldName;

  public FeatureAlignmentException(AlignmentFailure failure, String fieldName, String message) {
    super(message);
    this.failure = failure;
    this.fieldName = fieldName;
  }

  public AlignmentFailure failure() {
    return failure;
  }

  public String fieldName() {
    return fieldName;
  }
}
