/*
 * どこで: Inference Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: 予測/outcome API のログへ request_id を安定して埋め込むため
 */
package com.example.inference.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    // /metrics は高頻度で poll されるため MDC 付与の対象から外す
    registry.addInterceptor(requestMdcInterceptor).excludePathPatterns("/metrics");
  }
}
