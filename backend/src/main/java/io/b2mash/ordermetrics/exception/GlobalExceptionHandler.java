package io.b2mash.ordermetrics.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(DataAccessFailureException.class)
  public ResponseEntity<ProblemDetail> handleDataAccessFailure(
      DataAccessFailureException ex, HttpServletRequest request) {
    log.error(
        "Data access failure: path={}, operation={}, context={}",
        request.getRequestURI(),
        ex.getOperation(),
        ex.getContext(),
        ex.getCause());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ex.getBody());
  }

  @ExceptionHandler(InvalidStateException.class)
  public ResponseEntity<ProblemDetail> handleInvalidState(
      InvalidStateException ex, HttpServletRequest request) {
    log.warn(
        "Rejected request: path={}, reason={}", request.getRequestURI(), ex.getBody().getDetail());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }
}
