/*
 * どこで: Inference API
 * 何を: スコアリング artifact が未ロードであることを表現する
 * なぜ: サーバ側要因として 503 へ正規化し、クライアントの有限リトライ対象にするため
 */
package com.example.inference.api;

public class ArtifactUnavailableException extends RuntimeException {
  public ArtifactUnavailableException(String message) {
    super(message);
  }
}
