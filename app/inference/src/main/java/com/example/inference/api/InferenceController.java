/*
 * どこで: Inference API
 * 何を: 推論エンドポイント POST /predict を提供する
 * なぜ: 本文を生のまま受け取り、デコード失敗も含めて推論リクエストとして計測するため
 */
package com.example.inference.api;

import com.example.inference.config.RequestMdcInterceptor;
import com.example.inference.service.InferenceService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class InferenceController {

  private final InferenceService inferenceService;

  @PostMapping("/predict")
  public PredictionResponse predict(
      @RequestBody(required = false) String body, HttpServletRequest request) {
    return inferenceService.predict(resolveRequestId(request), body);
  }

  private String resolveRequestId(HttpServletRequest request) {
    // interceptor が採番した ID を優先し、応答ヘッダと本文の request_id を一致させる
    if (request.getAttribute(RequestMdcInterceptor.ATTRIBUTE_REQUEST_ID) instanceof String id) {
      return id;
    }
    final String header = request.getHeader(RequestMdcInterceptor.HEADER_REQUEST_ID);
    if (header != null && !header.isBlank()) {
      return header.trim();
    }
    return UUID.randomUUID().toString();
  }
}
