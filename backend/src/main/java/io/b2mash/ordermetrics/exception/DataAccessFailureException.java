package io.b2mash.ordermetrics.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * A read against the order store failed (connectivity, bad SQL, ...). Carries the repository
 * operation and the id or filter it was called with so the failure can be traced from the log. An
 * empty result is never reported through this exception.
 */
public class DataAccessFailureException extends ErrorResponseException {

  private final String operation;
  private final String context;

  public DataAccessFailureException(String operation, String context, DataAccessException cause) {
    super(
        HttpStatus.SERVICE_UNAVAILABLE,
        Problems.of(
            HttpStatus.SERVICE_UNAVAILABLE,
            "Order data unavailable",
            "Reading order data failed during " + operation),
        cause);
    this.operation = operation;
    this.context = context;
    getBody().setProperty("operation", operation);
  }

  public String getOperation() {
    return operation;
  }

  public String getContext() {
    return context;
  }

  @Override
  public String getMessage() {
    return "Data access failed: operation=" + operation + ", context=" + context;
  }
}
