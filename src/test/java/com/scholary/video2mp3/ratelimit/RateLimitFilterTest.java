package com.scholary.video2mp3.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.scholary.video2mp3.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitFilterTest {

  private final ObjectMapper objectMapper =
      new ObjectMapper().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
  private RateLimitFilter filter;

  @BeforeEach
  void setUp() {
    MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    filter =
        new RateLimitFilter(
            new FixedWindowRateLimiter(1, Duration.ofSeconds(30), 100, clock),
            new ClientIdentityResolver(),
            objectMapper);
  }

  @Test
  void doFilter_shouldPassAndSetHeadersWithinLimit() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request("/jobs"), response, chain);

    assertThat(chain.getRequest()).isNotNull();
    assertThat(response.getHeader("X-RateLimit-Limit")).isEqualTo("1");
    assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("0");
  }

  @Test
  void doFilter_shouldRejectWith429AndRetryAfter() throws Exception {
    filter.doFilter(request("/jobs"), new MockHttpServletResponse(), new MockFilterChain());
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request("/jobs"), response, chain);

    assertThat(chain.getRequest()).isNull();
    assertThat(response.getStatus()).isEqualTo(429);
    assertThat(response.getHeader("Retry-After")).isEqualTo("30");
    JsonNode body = objectMapper.readTree(response.getContentAsString());
    assertThat(body.get("error").asText()).isEqualTo("rate_limited");
    assertThat(body.get("retry_after").asLong()).isEqualTo(30);
  }

  @Test
  void doFilter_shouldSkipHealthAndEventStreams() throws Exception {
    for (int i = 0; i < 3; i++) {
      MockFilterChain health = new MockFilterChain();
      MockFilterChain events = new MockFilterChain();
      filter.doFilter(request("/healthz"), new MockHttpServletResponse(), health);
      filter.doFilter(request("/jobs/abc/events"), new MockHttpServletResponse(), events);
      assertThat(health.getRequest()).isNotNull();
      assertThat(events.getRequest()).isNotNull();
    }
  }

  private static MockHttpServletRequest request(String path) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
    request.setRemoteAddr("10.0.0.1");
    return request;
  }
}
