package com.meshx.exchange.events;

/**
 * Soft outcomes: the call succeeds, moves nothing, and reports why.
 */
public enum RejectReason {
  ORDER_EXPIRED("OrderExpired"),
  ORDER_UNFILLABLE("OrderUnfillable"),
  ROUNDING_ERROR_TOO_LARGE("RoundingErrorTooLarge");

  private final String eventType;

  RejectReason(String eventType) {
    this.eventType = eventType;
  }

  public String eventType() {
    return eventType;
  }
}
