package com.example.vrf.security.filter;

import com.example.vrf.service.FixedWindowRateLimiter.Decision;
import com.example.vrf.service.RequestRateLimiter;
import com.example.vrf.util.ClientRequestUtils;
import com.example.vrf.web.rest.ApiConstants.ApiPath;
import com.example.vrf.web.rest.ApiConstants.Header;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the per-IP limit to every {@code /v1} route and the per-payment limit
 * to the randomness routes. Rejections are written here as 429 with the usual
 * error body; the rate-limit headers are set on every response.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitFilter extends OncePerRequestFilter {

  private static final String RANDOM_PREFIX = ApiPath.V1_BASE + ApiPath.RANDOM_BASE + "/";
  private static final String RANDOMNESS_PATH = ApiPath.V1_BASE + ApiPath.RANDOMNESS;

  private final RequestRateLimiter rateLimiter;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith(ApiPath.V1_BASE + "/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
  ) throws ServletException, IOException {

    String clientIp = ClientRequestUtils.getClientIpAddress(request);
    Decision decision = rateLimiter.checkGlobal(clientIp);

    if (decision.allowed() && isRandomnessRoute(request.getRequestURI())) {
      decision = rateLimiter.checkPaid(ClientRequestUtils.getPaymentHeader(request), clientIp);
    }

    writeRateLimitHeaders(response, decision);
    if (!decision.allowed()) {
      log.warn("Rate limit exceeded for {} on {}",
               ClientRequestUtils.maskIpAddress(clientIp), request.getRequestURI());
      rejectRequest(request, response, decision);
      return;
    }

    filterChain.doFilter(request, response);
  }

  static boolean isRandomnessRoute(String uri) {
    return uri.equals(RANDOMNESS_PATH) || uri.startsWith(RANDOM_PREFIX);
  }

  private void writeRateLimitHeaders(HttpServletResponse response, Decision decision) {
    response.setHeader(Header.RATE_LIMIT_LIMIT, String.valueOf(decision.limit()));
    response.setHeader(Header.RATE_LIMIT_REMAINING, String.valueOf(decision.remaining()));
    response.setHeader(Header.RATE_LIMIT_RESET, String.valueOf(decision.resetAt().getEpochSecond()));
  }

  private void rejectRequest(HttpServletRequest request, HttpServletResponse response,
                             Decision decision) throws IOException {
    Instant now = Instant.now(clock);
    long retryAfter = Math.max(1, decision.resetAt().getEpochSecond() - now.getEpochSecond());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", now.toString());
    body.put("status", HttpStatus.TOO_MANY_REQUESTS.value());
    body.put("error", "rate_limited");
    body.put("message", "Rate limit exceeded. Try again later.");
    body.put("path", request.getRequestURI());

    response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
    response.setHeader(Header.RETRY_AFTER, String.valueOf(retryAfter));
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
