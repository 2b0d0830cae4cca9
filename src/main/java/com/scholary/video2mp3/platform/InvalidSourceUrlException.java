package com.scholary.video2mp3.platform;

/** The submitted link is missing, malformed or from a platform we do not support. */
public class InvalidSourceUrlException extends RuntimeException {

  public InvalidSourceUrlException(String message) {
    super(message);
  }
}
