/*
 * どこで: Inference API
 * 何を: GET /metrics でメトリクスのスナップショットをテキスト形式で返す
 * なぜ: Prometheus などの収集側が Accept ヘッダで形式を選べるようにするため
 */
package com.example.inference.api;

import com.example.inference.service.TelemetrySink;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MetricsController {

  private final TelemetrySink telemetrySink;

  @GetMapping("/metrics")
  public ResponseEntity<String> metrics(
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    final TelemetrySink.RenderedMetrics rendered = telemetrySink.render(accept);
    return ResponseEntity.ok()
        .header(HttpHeaders.CONTENT_TYPE, rendered.contentType())
        .body(rendered.body());
  }
}
