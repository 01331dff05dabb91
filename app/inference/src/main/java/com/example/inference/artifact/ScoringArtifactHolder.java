/*
 * どこで: Inference artifact 層
 * 何を: 現在の artifact を 1 つだけ保持し、起動時ロードと原子的な差し替えを行う
 * なぜ: 推論中のリクエストが差し替え途中の schema と係数を混ぜて読まないようにするため
 */
package com.example.inference.artifact;

import com.example.inference.api.ArtifactUnavailableException;
import com.example.inference.config.InferenceArtifactProperties;
import com.example.inference.service.InferenceMetrics;
import jakarta.annotation.PostConstruct;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ScoringArtifactHolder {

  private static final Logger logger = LoggerFactory.getLogger(ScoringArtifactHolder.class);

  public enum ReloadResult {
    SWAPPED,
    UNCHANGED,
    FAILED;

    public String value() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final ScoringArtifactLoader loader;
  private final InferenceArtifactProperties properties;
  private final InferenceMetrics metrics;
  private final AtomicReference<ScoringArtifact> current = new AtomicReference<>();

  public ScoringArtifactHolder(
      ScoringArtifactLoader loader,
      InferenceArtifactProperties properties,
      InferenceMetrics metrics) {
    this.loader = loader;
    this.properties = properties;
    this.metrics = metrics;
  }

  @PostConstruct
  public void loadInitial() {
    try {
      final ScoringArtifact artifact = loader.load(properties.location());
      current.set(artifact);
      metrics.updateArtifactLoaded(true);
      logger.info(
          "scoring artifact loaded modelVersion={} width={} location={}",
          artifact.modelVersion(),
          artifact.schema().width(),
          properties.location());
    } catch (ArtifactLoadException ex) {
      if (properties.failFast()) {
        throw ex;
      }
      metrics.updateArtifactLoaded(false);
      logger.error(
          "scoring artifact load failed; serving without an artifact location={}",
          properties.location(),
          ex);
    }
  }

  /**
   * 役割: 推論 1 件分の artifact スナップショットを返す。
   * 動作: 参照を 1 回だけ読む。呼び出し側は返り値を整列とスコアリングの両方に使う。
   * 前提: 未ロード時は ArtifactUnavailableException を投げる。
   */
  public ScoringArtifact require() {
    final ScoringArtifact artifact = current.get();
    if (artifact == null) {
      throw new ArtifactUnavailableException("scoring artifact is not loaded");
    }
    return artifact;
  }

  public Optional<ScoringArtifact> current() {
    return Optional.ofNullable(current.get());
  }

  /**
   * 役割: artifact ソースを読み直し、版が変わっていれば差し替える。
   * 動作: ロード失敗時は現行 artifact を保持したまま FAILED を返す。同じ版なら UNCHANGED。
   * 前提: 差し替えは参照の set のみで、進行中のリクエストは旧スナップショットで完了する。
   */
  public ReloadResult reload() {
    final ReloadResult result = reloadQuietly();
    metrics.recordArtifactReload(result.value());
    return result;
  }

  /**
   * 役割: 管理 API から明示的に再読込する。
   * 動作: reload と同じだが、失敗時はロード例外をそのまま呼び出し側へ伝える。
   * 前提: 失敗しても現行 artifact は保持される。
   */
  public ReloadResult reloadOrThrow() {
    final ScoringArtifact loaded;
    try {
      loaded = loader.load(properties.location());
    } catch (ArtifactLoadException ex) {
      metrics.recordArtifactReload(ReloadResult.FAILED.value());
      logger.warn("scoring artifact reload failed location={}", properties.location(), ex);
      throw ex;
    }
    final ReloadResult result = swapIfNewVersion(loaded);
    metrics.recordArtifactReload(result.value());
    return result;
  }

  private ReloadResult reloadQuietly() {
    final ScoringArtifact loaded;
    try {
      loaded = loader.load(properties.location());
    } catch (ArtifactLoadException ex) {
      logger.warn(
          "scoring artifact reload failed; keeping current modelVersion={}",
          current().map(ScoringArtifact::modelVersion).orElse("none"),
          ex);
      return ReloadResult.FAILED;
    }
    return swapIfNewVersion(loaded);
  }

  private ReloadResult swapIfNewVersion(ScoringArtifact loaded) {
    final ScoringArtifact previous = current.get();
    if (previous != null && previous.modelVersion().equals(loaded.modelVersion())) {
      return ReloadResult.UNCHANGED;
    }
    if (!current.compareAndSet(previous, loaded)) {
      // 並行した再読込が先に差し替えた場合はそちらを正とする
      return ReloadResult.UNCHANGED;
    }
    metrics.updateArtifactLoaded(true);
    logger.info(
        "scoring artifact swapped previousVersion={} modelVersion={}",
        previous == null ? "none" : previous.modelVersion(),
        loaded.modelVersion());
    return ReloadResult.SWAPPED;
  }
}
