package com.scholary.video2mp3.queue;

/** The dispatcher could not accept a task. The job keeps its stored status. */
public class DispatchException extends RuntimeException {

  public DispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
