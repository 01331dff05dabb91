package com.example.inference.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveMdcValuesAroundRequestLifecycle() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/predict");
    request.addHeader("X-Request-Id", " req-1 ");
    request.addHeader("X-Forwarded-For", "10.0.0.1, 10.0.0.2");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("http_path")).isEqualTo("/predict");
    assertThat(MDC.get("client_ip")).isEqualTo("10.0.0.1");
    assertThat(request.getAttribute(RequestMdcInterceptor.ATTRIBUTE_REQUEST_ID))
        .isEqualTo("req-1");
    assertThat(response.getHeader(RequestMdcInterceptor.HEADER_REQUEST_ID)).isEqualTo("req-1");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("client_ip")).isNull();
  }

  @Test
  void generatesRequestIdWhenHeaderIsMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("POST", "/predict");
    request.setRemoteAddr("192.168.0.10");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    final String generated = response.getHeader(RequestMdcInterceptor.HEADER_REQUEST_ID);
    assertThat(generated).isNotBlank();
    assertThat(MDC.get("request_id")).isEqualTo(generated);
    assertThat(MDC.get("client_ip")).isEqualTo("192.168.0.10");
  }
}
