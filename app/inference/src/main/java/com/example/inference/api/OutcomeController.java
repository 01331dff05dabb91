/*
 * どこで: Inference API
 * 何を: 実測ラベルの受け口 POST /v1/outcomes を提供する
 * なぜ: 後から確定するラベルを request id で予測記録へ結合するため
 */
package com.example.inference.api;

import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.OutcomeUpsertResult;
import com.example.inference.service.OutcomeLedgerService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class OutcomeController {

  private final OutcomeLedgerService ledgerService;
  private final Clock clock;

  @PostMapping("/outcomes")
  public ResponseEntity<OutcomeResponse> record(@Valid @RequestBody OutcomeRequest request) {
    final Instant observedAt =
        request.observedAt() == null ? Instant.now(clock) : request.observedAt();
    final OutcomeUpsertResult result =
        ledgerService.recordOutcome(
            new OutcomeUpdate(request.requestId().trim(), request.realizedLabel(), observedAt));
    if (result == OutcomeUpsertResult.CONFLICT) {
      throw new OutcomeConflictException(request.requestId());
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new OutcomeResponse(request.requestId().trim(), result.value()));
  }
}
