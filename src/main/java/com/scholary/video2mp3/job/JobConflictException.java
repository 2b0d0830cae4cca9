package com.scholary.video2mp3.job;

/**
 * Thrown when an action is not valid for a job's current state, such as downloading a job that is
 * not ready, retrying a job that is still active, or creating a job whose id already exists.
 */
public class JobConflictException extends RuntimeException {

  public JobConflictException(String message) {
    super(message);
  }
}
