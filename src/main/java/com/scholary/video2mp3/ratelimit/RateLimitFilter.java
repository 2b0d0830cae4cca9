package com.scholary.video2mp3.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video2mp3.api.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the {@link RateLimiter} to incoming requests.
 *
 * <p>Health checks and status streams are exempt. Every limited request gets {@code
 * X-RateLimit-Limit} and {@code X-RateLimit-Remaining}; a rejected one is answered with 429, a
 * {@code Retry-After} header and an error body carrying the same delay.
 */
public class RateLimitFilter extends OncePerRequestFilter {

  private final RateLimiter rateLimiter;
  private final ClientIdentityResolver identityResolver;
  private final ObjectMapper objectMapper;

  public RateLimitFilter(
      RateLimiter rateLimiter, ClientIdentityResolver identityResolver, ObjectMapper objectMapper) {
    this.rateLimiter = rateLimiter;
    this.identityResolver = identityResolver;
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return "/healthz".equals(path) || path.endsWith("/events");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    RateLimitDecision decision = rateLimiter.allow(identityResolver.resolve(request));
    response.setHeader("X-RateLimit-Limit", String.valueOf(rateLimiter.limit()));
    response.setHeader("X-RateLimit-Remaining", String.valueOf(decision.remaining()));

    if (!decision.allowed()) {
      long seconds = decision.retryAfterSeconds();
      response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
      response.setHeader("Retry-After", String.valueOf(seconds));
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      objectMapper.writeValue(
          response.getOutputStream(),
          ErrorResponse.rateLimited("rate limit exceeded", seconds));
      return;
    }
    chain.doFilter(request, response);
  }
}
