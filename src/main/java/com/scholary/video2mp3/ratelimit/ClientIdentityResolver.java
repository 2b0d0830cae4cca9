package com.scholary.video2mp3.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Derives the rate-limit key for a request.
 *
 * <p>First entry of {@code X-Forwarded-For}, then {@code X-Real-IP}, then the connection's remote
 * address.
 */
public class ClientIdentityResolver {

  static final String UNKNOWN = "unknown";

  public String resolve(HttpServletRequest request) {
    String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded != null && !forwarded.isBlank()) {
      String first = forwarded.split(",")[0].trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    String realIp = request.getHeader("X-Real-IP");
    if (realIp != null && !realIp.isBlank()) {
      return realIp.trim();
    }
    String remote = request.getRemoteAddr();
    if (remote != null && !remote.isBlank()) {
      return remote;
    }
    return UNKNOWN;
  }
}
