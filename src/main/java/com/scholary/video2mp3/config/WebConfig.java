package com.scholary.video2mp3.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video2mp3.api.ApiProperties;
import com.scholary.video2mp3.api.ApiTokenFilter;
import com.scholary.video2mp3.ratelimit.ClientIdentityResolver;
import com.scholary.video2mp3.ratelimit.FixedWindowRateLimiter;
import com.scholary.video2mp3.ratelimit.RateLimitFilter;
import com.scholary.video2mp3.ratelimit.RateLimitProperties;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

/**
 * Servlet filters in front of the API.
 *
 * <p>Order is CORS, then rate limiting, then token authentication, so rejected requests still
 * carry CORS headers and unauthenticated clients still count against their limit. CORS and token
 * registrations stay disabled while unconfigured; the rate limiter is only registered with a
 * positive {@code ratelimit.per-minute}.
 */
@Configuration
@EnableConfigurationProperties({ApiProperties.class, RateLimitProperties.class})
public class WebConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebConfig.class);

  @Bean
  public FilterRegistrationBean<CorsFilter> corsFilter(ApiProperties properties) {
    List<String> origins = properties.allowedOrigins();
    CorsConfiguration cors = new CorsConfiguration();
    cors.setAllowedOrigins(origins);
    cors.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
    cors.setAllowedHeaders(List.of("Authorization", "Content-Type", "X-API-KEY"));
    cors.setExposedHeaders(List.of("Retry-After", "X-RateLimit-Limit", "X-RateLimit-Remaining"));

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", cors);

    FilterRegistrationBean<CorsFilter> registration =
        new FilterRegistrationBean<>(new CorsFilter(source));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
    registration.setEnabled(!origins.isEmpty());
    return registration;
  }

  @Bean
  @ConditionalOnExpression("${ratelimit.per-minute:0} > 0")
  public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(
      RateLimitProperties properties, ObjectMapper objectMapper, Clock clock) {
    RateLimitFilter filter =
        new RateLimitFilter(
            new FixedWindowRateLimiter(
                properties.perMinute(), properties.window(), properties.maxClients(), clock),
            new ClientIdentityResolver(),
            objectMapper);
    FilterRegistrationBean<RateLimitFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }

  @Bean
  public FilterRegistrationBean<ApiTokenFilter> apiTokenFilter(
      ApiProperties properties, ObjectMapper objectMapper) {
    boolean required = properties.tokenRequired();
    if (!required) {
      LOGGER.warn("No API token configured, API is unauthenticated");
    }
    FilterRegistrationBean<ApiTokenFilter> registration =
        new FilterRegistrationBean<>(
            new ApiTokenFilter(required ? properties.token() : "", objectMapper));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 20);
    registration.setEnabled(required);
    return registration;
  }
}
