package io.b2mash.ordermetrics.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Rejected request parameters, e.g. an inverted date range or a page number below 1. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, Problems.of(HttpStatus.BAD_REQUEST, title, detail), null);
  }
}
