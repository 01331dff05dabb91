/*
 * どこで: Inference API
 * 何を: drift 判定の参照と即時評価のエンドポイントを提供する
 * なぜ: 次の定期サイクルを待たずに監視状態を確認・再評価できるようにするため
 */
package com.example.inference.api;

import com.example.inference.model.DriftVerdict;
import com.example.inference.service.DriftMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/drift")
@RequiredArgsConstructor
public class DriftController {

  private final DriftMonitor driftMonitor;

  @GetMapping("/verdict")
  public ResponseEntity<DriftVerdictResponse> latest() {
    final DriftMonitor.MonitorSnapshot snapshot = driftMonitor.snapshot();
    return snapshot
        .latestVerdict()
        .map(verdict -> ResponseEntity.ok(toResponse(snapshot, verdict)))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @PostMapping("/evaluations")
  public DriftVerdictResponse evaluate() {
    final DriftVerdict verdict = driftMonitor.evaluateNow();
    return toResponse(driftMonitor.snapshot(), verdict);
  }

  private DriftVerdictResponse toResponse(
      DriftMonitor.MonitorSnapshot snapshot, DriftVerdict verdict) {
    return DriftVerdictResponse.of(snapshot.state().name(), snapshot.cooldownUntil(), verdict);
  }
}
