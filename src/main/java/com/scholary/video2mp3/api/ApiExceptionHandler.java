package com.scholary.video2mp3.api;

import com.scholary.video2mp3.job.JobConflictException;
import com.scholary.video2mp3.job.JobNotFoundException;
import com.scholary.video2mp3.objectstore.ObjectStoreException;
import com.scholary.video2mp3.platform.InvalidSourceUrlException;
import com.scholary.video2mp3.service.ResultNotFoundException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps exceptions to {@link ErrorResponse} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({InvalidSourceUrlException.class, InvalidRequestException.class})
  public ResponseEntity<ErrorResponse> handleValidation(RuntimeException e) {
    return respond(HttpStatus.BAD_REQUEST, "validation", e.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    return respond(HttpStatus.BAD_REQUEST, "validation", message);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
    return respond(HttpStatus.BAD_REQUEST, "validation", "invalid request");
  }

  @ExceptionHandler({JobNotFoundException.class, ResultNotFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
    return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
  }

  @ExceptionHandler(JobConflictException.class)
  public ResponseEntity<ErrorResponse> handleConflict(JobConflictException e) {
    return respond(HttpStatus.CONFLICT, "conflict", e.getMessage());
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ErrorResponse> handlePersistence(DataAccessException e) {
    LOGGER.error("Job store failure", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "persistence", "job store unavailable");
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ErrorResponse> handleStorage(ObjectStoreException e) {
    LOGGER.error("Object store failure", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "storage", "failed to sign mp3 url");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
    LOGGER.error("Unhandled error", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "internal error");
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String kind, String message) {
    return ResponseEntity.status(status).body(ErrorResponse.of(kind, message));
  }
}
