package com.scholary.video2mp3.job;

/** Helpers for the bounded error text stored on failed jobs. */
public final class JobErrors {

  private JobErrors() {}

  /** Cut {@code message} to {@code max} characters, marking the cut with "...". */
  public static String truncate(String message, int max) {
    if (message == null) {
      return null;
    }
    if (max <= 0 || message.length() <= max) {
      return message;
    }
    return message.substring(0, max) + "...";
  }

  /** A non-empty description of {@code e}, falling back to its type when it has no message. */
  public static String describe(Throwable e) {
    String message = e.getMessage();
    if (message == null || message.isBlank()) {
      return e.getClass().getSimpleName();
    }
    return message;
  }
}
