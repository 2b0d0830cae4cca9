package com.scholary.video2mp3.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Unchecked: the pipeline treats a failed upload like any other I/O failure and lets the
 * dispatcher decide whether to try again.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
