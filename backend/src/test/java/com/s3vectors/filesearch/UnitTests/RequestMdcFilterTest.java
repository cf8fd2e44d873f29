package com.s3vectors.filesearch;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.FilterChain;

@DisplayName("RequestMdcFilter Tests")
class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();

  @Test
  @DisplayName("Should propagate the caller's correlation id")
  void shouldUseCallerCorrelationId() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/files");
    request.addHeader(RequestMdcFilter.CORRELATION_ID_HEADER, "abc-123");
    MockHttpServletResponse response = new MockHttpServletResponse();
    AtomicReference<String> seen = new AtomicReference<>();
    FilterChain chain = (req, res) -> seen.set(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY));

    filter.doFilter(request, response, chain);

    assertThat(seen.get()).isEqualTo("abc-123");
    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isEqualTo("abc-123");
    assertThat(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }

  @Test
  @DisplayName("Should generate a correlation id when none is sent")
  void shouldGenerateCorrelationId() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/query");
    MockHttpServletResponse response = new MockHttpServletResponse();
    AtomicReference<String> path = new AtomicReference<>();
    FilterChain chain = (req, res) -> path.set(MDC.get(RequestMdcFilter.REQUEST_PATH_MDC_KEY));

    filter.doFilter(request, response, chain);

    assertThat(response.getHeader(RequestMdcFilter.CORRELATION_ID_HEADER)).isNotBlank();
    assertThat(path.get()).isEqualTo("POST /api/query");
    assertThat(MDC.get(RequestMdcFilter.REQUEST_PATH_MDC_KEY)).isNull();
  }
}
