package com.scholary.video2mp3.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Shared-token authentication.
 *
 * <p>The token is accepted as {@code Authorization: Bearer <token>}, as {@code X-API-KEY} or as the
 * {@code token} query parameter, the last one being the only option for browser EventSource
 * clients. {@code /healthz} and CORS preflights are always let through.
 */
public class ApiTokenFilter extends OncePerRequestFilter {

  private static final String BEARER_PREFIX = "Bearer ";

  private final byte[] token;
  private final ObjectMapper objectMapper;

  public ApiTokenFilter(String token, ObjectMapper objectMapper) {
    this.token = token.getBytes(StandardCharsets.UTF_8);
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return "/healthz".equals(request.getRequestURI()) || "OPTIONS".equals(request.getMethod());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    if (!isAuthorized(request)) {
      response.setStatus(HttpStatus.UNAUTHORIZED.value());
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      objectMapper.writeValue(
          response.getOutputStream(),
          ErrorResponse.of("unauthorized", "missing or invalid API token"));
      return;
    }
    chain.doFilter(request, response);
  }

  private boolean isAuthorized(HttpServletRequest request) {
    String authorization = request.getHeader("Authorization");
    if (authorization != null
        && authorization.startsWith(BEARER_PREFIX)
        && matches(authorization.substring(BEARER_PREFIX.length()))) {
      return true;
    }
    if (matches(request.getHeader("X-API-KEY"))) {
      return true;
    }
    return matches(request.getParameter("token"));
  }

  private boolean matches(String candidate) {
    if (candidate == null || candidate.isEmpty()) {
      return false;
    }
    return MessageDigest.isEqual(token, candidate.getBytes(StandardCharsets.UTF_8));
  }
}
