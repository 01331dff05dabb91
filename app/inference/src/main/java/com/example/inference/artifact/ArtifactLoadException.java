/*
 * どこで: Inference artifact 層
 * 何を: artifact の読み込み/検証失敗を表現する
 * なぜ: 起動時は致命的、再読込時は旧 artifact 継続として扱い分けるため
 */
package com.example.inference.artifact;

public class ArtifactLoadException extends RuntimeException {
  public ArtifactLoadException(String message) {
    super(message);
  }

  public ArtifactLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
