package com.podium.api.tracing;

import com.podium.api.web.Callers;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every market call with a request id and the calling account.
 * A client supplied {@code X-Request-Id} is kept, otherwise one is generated;
 * either way it is returned on the response.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String MDC_REQUEST_ID = "requestId";
  public static final String MDC_CALLER = "caller";

  private static final int MAX_ID_LENGTH = 128;

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String requestId = requestIdOf(request);
    response.setHeader(HDR_REQUEST_ID, requestId);

    try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_REQUEST_ID, requestId);
         MDC.MDCCloseable alsoIgnored = MDC.putCloseable(MDC_CALLER, callerOf(request))) {
      chain.doFilter(request, response);
    }
  }

  static String requestIdOf(HttpServletRequest request) {
    String supplied = request.getHeader(HDR_REQUEST_ID);
    if (supplied == null || supplied.isBlank() || supplied.length() > MAX_ID_LENGTH) {
      return UUID.randomUUID().toString();
    }
    return supplied.trim();
  }

  /** Raw header value; "-" for anonymous reads. */
  static String callerOf(HttpServletRequest request) {
    String caller = request.getHeader(Callers.HEADER);
    return caller == null || caller.isBlank() ? "-" : caller.trim();
  }
}
