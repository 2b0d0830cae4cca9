package com.scholary.video2mp3.api;

/** A request is well-formed but its values are unusable. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
