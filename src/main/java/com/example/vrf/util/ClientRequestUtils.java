package com.example.vrf.util;

import jakarta.servlet.http.HttpServletRequest;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Extracts caller attributes from the servlet request
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ClientRequestUtils {

  public static final String API_KEY_HEADER = "X-API-Key";
  public static final String API_KEY_PARAM = "api_key";
  public static final String PAYMENT_SIGNATURE_HEADER = "PAYMENT-SIGNATURE";
  public static final String LEGACY_PAYMENT_HEADER = "X-Payment";

  /**
   * Extract client IP address. Forwarded headers are honoured only through the container's
   * forward-headers handling, which rewrites the remote address for trusted proxies.
   */
  public static String getClientIpAddress(HttpServletRequest request) {
    return request.getRemoteAddr();
  }

  /**
   * Origin header, falling back to Referer; empty when neither is present
   */
  public static String getOrigin(HttpServletRequest request) {
    String origin = request.getHeader("Origin");
    if (origin != null && !origin.isEmpty()) {
      return origin;
    }
    String referer = request.getHeader("Referer");
    return referer != null ? referer : "";
  }

  public static String getApiKey(HttpServletRequest request) {
    String header = request.getHeader(API_KEY_HEADER);
    if (header != null && !header.isBlank()) {
      return header.trim();
    }
    return request.getParameter(API_KEY_PARAM);
  }

  /**
   * x402 v2 header first, legacy header second
   */
  public static String getPaymentHeader(HttpServletRequest request) {
    String header = request.getHeader(PAYMENT_SIGNATURE_HEADER);
    if (header == null || header.isBlank()) {
      header = request.getHeader(LEGACY_PAYMENT_HEADER);
    }
    return header == null || header.isBlank() ? null : header.trim();
  }

  public static String maskIpAddress(String ip) {
    if (ip == null || !ip.contains(".")) {
      return "***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }
}
