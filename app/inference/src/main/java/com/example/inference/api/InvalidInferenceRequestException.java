/*
 * どこで: Inference API
 * 何を: リクエスト本文の妥当性エラーを表現する
 * なぜ: decode できない入力を 400 へ正規化するため
 */
package com.example.inference.api;

public class InvalidInferenceRequestException extends RuntimeException {
  public InvalidInferenceRequestException(String message) {
    super(message);
  }

  public InvalidInferenceRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
