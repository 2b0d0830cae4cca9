package com.scholary.video2mp3.resolver;

/**
 * The resolver could not produce a media URL.
 *
 * <p>Always terminal: a link the parser rejects once is rejected again on every retry.
 */
public class ResolutionException extends RuntimeException {

  public ResolutionException(String message) {
    super(message);
  }

  public ResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
