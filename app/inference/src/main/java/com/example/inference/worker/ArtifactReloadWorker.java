/*
 * どこで: Inference artifact 再読込ワーカー
 * 何を: artifact ソースを定期的に読み直し、新しい版があれば差し替える
 * なぜ: 学習ジョブが配置した新しい版を再起動なしで反映するため
 */
package com.example.inference.worker;

import com.example.inference.artifact.ScoringArtifactHolder;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "inference.artifact.reload-enabled", havingValue = "true")
public class ArtifactReloadWorker {

  private static final Logger logger = LoggerFactory.getLogger(ArtifactReloadWorker.class);

  private final ScoringArtifactHolder artifactHolder;

  @Scheduled(
      fixedDelayString = "${inference.artifact.reload-interval}",
      initialDelayString = "${inference.artifact.reload-interval}")
  public void run() {
    try {
      artifactHolder.reload();
    } catch (RuntimeException ex) {
      logger.warn("artifact reload worker failed", ex);
    }
  }
}
