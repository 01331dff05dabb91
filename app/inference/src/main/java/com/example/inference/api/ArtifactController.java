/*
 * どこで: Inference API
 * 何を: ロード中の artifact の参照と再読込のエンドポイントを提供する
 * なぜ: 学習ジョブが新しい版を配置した直後に、定期チェックを待たず差し替えられるようにするため
 */
package com.example.inference.api;

import com.example.inference.artifact.ScoringArtifact;
import com.example.inference.artifact.ScoringArtifactHolder;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/artifact")
@RequiredArgsConstructor
public class ArtifactController {

  private final ScoringArtifactHolder artifactHolder;

  @GetMapping
  public ArtifactResponse current() {
    return ArtifactResponse.of(artifactHolder.require());
  }

  @PostMapping("/reload")
  public ArtifactReloadResponse reload() {
    final ScoringArtifactHolder.ReloadResult result = artifactHolder.reloadOrThrow();
    final String modelVersion =
        artifactHolder.current().map(ScoringArtifact::modelVersion).orElse(null);
    return new ArtifactReloadResponse(result.value(), modelVersion);
  }
}
