package com.meshx.exchange.settlement;

/**
 * Derived from ledger values and the current time; never stored.
 */
public enum OrderStatus {
  /** Zero maker or taker amount; can never be filled. */
  INVALID,
  FRESH,
  PARTIALLY_FILLED,
  /** Nothing remains and none of it was cancelled. */
  FULLY_FILLED,
  /** Nothing remains and at least part of it was cancelled. */
  CANCELLED,
  EXPIRED,
  /** Salt is below the maker's cancellation epoch. */
  BULK_CANCELLED;

  public boolean isFillable() {
    return this == FRESH || this == PARTIALLY_FILLED;
  }
}
