package com.meshx.exchange.settlement;

/**
 * Raised by an {@link AssetSettlement} when a transfer cannot complete. Nothing may have moved.
 */
public class SettlementException extends Exception {

  public SettlementException(String message) {
    super(message);
  }

  public SettlementException(String message, Throwable cause) {
    super(message, cause);
  }
}
