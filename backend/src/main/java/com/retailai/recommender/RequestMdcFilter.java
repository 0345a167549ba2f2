package com.retailai.recommender;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String CALLER_MDC_KEY = "caller";
  static final String CALLER_HEADER = "X-Caller";
  static final String DEFAULT_CALLER = "anonymous";
  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String caller = request.getHeader(CALLER_HEADER);
      MDC.put(CALLER_MDC_KEY, caller == null || caller.isBlank() ? DEFAULT_CALLER : caller);

      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId == null || correlationId.isBlank()) {
        correlationId = UUID.randomUUID().toString();
      }
      MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      response.setHeader(CORRELATION_ID_HEADER, correlationId);

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CALLER_MDC_KEY);
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }
}
