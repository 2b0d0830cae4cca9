package com.scholary.video2mp3.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body for every non-2xx response.
 *
 * <p>{@code error} is a machine-readable kind ({@code validation}, {@code not_found}, {@code
 * conflict}, {@code unauthorized}, {@code rate_limited}, {@code persistence}, {@code storage},
 * {@code internal}); {@code retryAfter} is only set for rate-limit rejections.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, Long retryAfter) {

  public static ErrorResponse of(String error, String message) {
    return new ErrorResponse(error, message, null);
  }

  public static ErrorResponse rateLimited(String message, long retryAfterSeconds) {
    return new ErrorResponse("rate_limited", message, retryAfterSeconds);
  }
}
