package com.retailai.recommender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@DisplayName("RequestMdcFilter Tests")
class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();

  private final AtomicReference<String> seenCaller = new AtomicReference<>();
  private final AtomicReference<String> seenCorrelationId = new AtomicReference<>();

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  private MockFilterChain recordingChain() {
    HttpServlet servlet =
        new HttpServlet() {
          @Override
          protected void service(HttpServletRequest req, HttpServletResponse resp) {
            seenCaller.set(MDC.get(RequestMdcFilter.CALLER_MDC_KEY));
            seenCorrelationId.set(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY));
          }
        };
    return new MockFilterChain(servlet);
  }

  @Test
  @DisplayName("Should expose caller and correlation id to the handler and echo the id")
  void propagatesHeaders() throws Exception {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    request.addHeader(RequestMdcFilter.CALLER_HEADER, "storefront");
    request.addHeader(RequestMdcFilter.CORRELATION_ID_HEADER, "corr-42");
    MockHttpServletResponse response = new MockHttpServletResponse();

    // When
    filter.doFilter(request, response, recordingChain());

    // Then
    assertThat(seenCaller.get()).isEqualTo("storefront");
    assertThat(seenCorrelationId.get()).isEqualTo("corr-42");
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo("corr-42");
  }

  @Test
  @DisplayName("Should fall back to an anonymous caller and a generated correlation id")
  void generatesDefaults() throws Exception {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    request.addHeader(RequestMdcFilter.CALLER_HEADER, "  ");
    MockHttpServletResponse response = new MockHttpServletResponse();

    // When
    filter.doFilter(request, response, recordingChain());

    // Then
    assertThat(seenCaller.get()).isEqualTo(RequestMdcFilter.DEFAULT_CALLER);
    assertThat(seenCorrelationId.get()).isNotBlank();
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER))
        .isEqualTo(seenCorrelationId.get());
  }

  @Test
  @DisplayName("Should clear the MDC after the request even when the handler fails")
  void clearsMdc() {
    // Given
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    MockHttpServletResponse response = new MockHttpServletResponse();
    HttpServlet failing =
        new HttpServlet() {
          @Override
          protected void service(HttpServletRequest req, HttpServletResponse resp) {
            throw new IllegalStateException("boom");
          }
        };

    // When & Then
    assertThatThrownBy(() -> filter.doFilter(request, response, new MockFilterChain(failing)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("boom");
    assertThat(MDC.get(RequestMdcFilter.CALLER_MDC_KEY)).isNull();
    assertThat(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }
}
