package com.s3vectors.filesearch;

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

/** Tags every log line of a request with its correlation id and echoes the id to the caller. */
@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
  static final String REQUEST_PATH_MDC_KEY = "requestPath";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId == null || correlationId.isBlank()) {
        correlationId = UUID.randomUUID().toString();
      }

      MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      MDC.put(REQUEST_PATH_MDC_KEY, request.getMethod() + " " + request.getRequestURI());
      response.setHeader(CORRELATION_ID_HEADER, correlationId);

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_MDC_KEY);
      MDC.remove(REQUEST_PATH_MDC_KEY);
    }
  }
}
