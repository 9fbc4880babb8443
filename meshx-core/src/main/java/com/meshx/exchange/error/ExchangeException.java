package com.meshx.exchange.error;

import java.util.Objects;

public class ExchangeException extends RuntimeException {

  private final ExchangeError error;

  public ExchangeException(ExchangeError error, String message) {
    super(error + ": " + message);
    this.error = Objects.requireNonNull(error, "error");
  }

  public ExchangeException(ExchangeError error, String message, Throwable cause) {
    super(error + ": " + message, cause);
    this.error = Objects.requireNonNull(error, "error");
  }

  public ExchangeError error() {
    return error;
  }
}
