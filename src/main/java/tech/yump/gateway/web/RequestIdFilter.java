package tech.yump.gateway.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id, exposed as a request attribute (for audit events),
 * in the logging MDC and as a response header.
 */
@Slf4j
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String REQUEST_ID_HEADER = "X-Request-Id";
  public static final String REQUEST_ID_ATTR = "auditRequestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String incoming = request.getHeader(REQUEST_ID_HEADER);
    String requestId = isUsable(incoming) ? incoming : UUID.randomUUID().toString();

    request.setAttribute(REQUEST_ID_ATTR, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);
    try {
      log.trace("Handling {} {}", request.getMethod(), request.getRequestURI());
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }

  // Caller-supplied ids end up in logs, so only accept short, plain tokens.
  private static boolean isUsable(String requestId) {
    return StringUtils.hasText(requestId)
            && requestId.length() <= 64
            && requestId.matches("[A-Za-z0-9._-]+");
  }
}
