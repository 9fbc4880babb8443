package com.meshx.exchange.events;

/**
 * Record emitted by the settlement core for observers and external indexers.
 */
public interface ExchangeEvent {

  /**
   * Stable name of the record kind, e.g. {@code Fill} or {@code OrderExpired}.
   */
  String type();
}
